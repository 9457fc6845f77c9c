package com.partassist.chat;

import com.partassist.answer.AnswerPayload;

public record TurnResponse(AnswerPayload payload, String sourceTag, String sessionId) {
}
