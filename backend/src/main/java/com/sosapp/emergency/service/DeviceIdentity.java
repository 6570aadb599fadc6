package com.sosapp.emergency.service;

public record DeviceIdentity(String deviceId, Long userId) {
}
