package com.linlay.carassist.model.api;

public record ChatResponse(
        String reply
) {
}
