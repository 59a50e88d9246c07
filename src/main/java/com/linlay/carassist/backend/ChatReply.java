package com.linlay.carassist.backend;

public record ChatReply(String text, boolean delivered, int attempts) {

    public static ChatReply delivered(String text, int attempts) {
        return new ChatReply(text, true, attempts);
    }

    public static ChatReply apology(String apology, int attempts) {
        return new ChatReply(apology, false, attempts);
    }
}
