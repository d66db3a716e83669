package com.questrail.empire.protocol.gge.login;

import java.util.Objects;

/**
 * Result of the account step of a connect attempt.
 */
public sealed interface LoginOutcome
{
    LoginOutcome SUCCESS = new Success();

    /** Logged in; the connection enters steady state. */
    record Success() implements LoginOutcome {
    }

    /** The server rejected the account. Terminal: no retry is scheduled. */
    record InvalidCredentials(int status) implements LoginOutcome {
    }

    /** Any other failure; retried after the login retry delay. */
    record Failed(String message) implements LoginOutcome {
        public Failed {
            Objects.requireNonNull(message, "message");
        }
    }
}
