package com.sosapp.emergency.model;

public enum NotificationChannel {
    PUSH,
    SMS,
    EMAIL
}
