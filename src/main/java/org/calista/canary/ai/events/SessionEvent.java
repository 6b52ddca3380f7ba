package org.calista.canary.ai.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** One line of the session audit log. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SessionEvent {

    public static final String OBSERVATION = "OBSERVATION";
    public static final String STRATEGY = "STRATEGY";
    public static final String ANSWER = "ANSWER";
    public static final String SNAPSHOT = "SNAPSHOT";

    public String type;
    public long tsEpochMs;
    public String sessionId;
    public String text;        // payload: observation id + source, decision + reason, degradation level, file

    public static SessionEvent of(String type, String sessionId, String text, long tsEpochMs) {
        SessionEvent e = new SessionEvent();
        e.type = type;
        e.sessionId = sessionId;
        e.text = text;
        e.tsEpochMs = tsEpochMs;
        return e;
    }

    @Override
    public String toString() {
        return type + "@" + tsEpochMs + "[" + sessionId + "] " + text;
    }
}
