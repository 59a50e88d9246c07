package com.linlay.carassist.sms;

public interface SmsGateway {

    void send(String toNumber, String text);
}
