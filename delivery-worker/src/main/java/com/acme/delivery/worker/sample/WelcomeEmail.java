package com.acme.delivery.worker.sample;

import java.time.Instant;

/** Work-queue job: one welcome email to send. */
public record WelcomeEmail(String userId, String email, Instant registeredAt) {}
