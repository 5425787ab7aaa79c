/*
 * どこで: Backoffice アプリの設定バインド
 * 何を: 永続化競合時にコマンド全体をやり直す上限回数
 */
package com.example.backoffice.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "backoffice.command")
public record CommandProperties(@Min(0) int maxConflictRetries) {}
