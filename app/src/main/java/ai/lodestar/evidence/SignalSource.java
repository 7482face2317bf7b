package ai.lodestar.evidence;

import java.util.Locale;

/** Where a signal was observed. */
public enum SignalSource {
    USER_MESSAGE,
    ERROR_OUTPUT,
    STACK_TRACE,
    WORKING_SET,
    ENVIRONMENT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
