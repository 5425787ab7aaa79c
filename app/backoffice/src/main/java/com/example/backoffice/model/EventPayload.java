/*
 * どこで: Backoffice ドメイン層
 * 何を: ドメインイベントのペイロード (集約ごとの不変 record) の目印
 */
package com.example.backoffice.model;

public interface EventPayload {}
