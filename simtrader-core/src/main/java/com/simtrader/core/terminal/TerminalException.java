package com.simtrader.core.terminal;

/**
 * A terminal call could not be carried out, for example because the
 * connection or the event loop failed. Trade rejections are not exceptions,
 * they are reported through the result retcode.
 */
public class TerminalException extends Exception {

    public TerminalException(String message) {
        super(message);
    }

    public TerminalException(String message, Throwable cause) {
        super(message, cause);
    }
}
