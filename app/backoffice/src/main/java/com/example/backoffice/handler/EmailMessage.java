package com.example.backoffice.handler;

import java.util.UUID;

public record EmailMessage(UUID messageKey, String to, String subject, String body) {}
