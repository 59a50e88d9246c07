package com.linlay.carassist.support;

import com.linlay.carassist.session.SessionContext;

public final class TestSessions {

    public static final String ESCALATION_PHONE = "+15125550100";

    private TestSessions() {
    }

    public static SessionContext session(String storageDescriptor) {
        return new SessionContext("5f1c2a9e-0000-4000-8000-000000000001", 77L, 5L, ESCALATION_PHONE, storageDescriptor);
    }
}
