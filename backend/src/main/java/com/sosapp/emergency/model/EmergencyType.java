package com.sosapp.emergency.model;

public enum EmergencyType {
    MEDICAL,
    FIRE,
    SAFETY,
    FALL,
    OTHER
}
