package com.linlay.agentroom.critic;

@FunctionalInterface
public interface CriticAlertListener {

    void onAlert(CriticAlert alert);
}
