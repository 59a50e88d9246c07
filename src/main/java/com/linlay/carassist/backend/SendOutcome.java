package com.linlay.carassist.backend;

public record SendOutcome(String text, boolean badRequest) {

    public SendOutcome {
        text = text == null ? "" : text;
    }

    public static SendOutcome empty() {
        return new SendOutcome("", false);
    }

    public boolean delivered() {
        return !badRequest && !text.isBlank();
    }
}
