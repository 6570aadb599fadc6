package com.sosapp.emergency.event;

@FunctionalInterface
public interface EmergencyEventHandler {

    void handle(EmergencyEvent event);
}
