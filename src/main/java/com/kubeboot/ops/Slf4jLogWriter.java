package com.kubeboot.ops;

import org.slf4j.Logger;

import java.io.Writer;

/**
 * Writer that forwards each completed line of command output to an SLF4J logger.
 */
public class Slf4jLogWriter extends Writer {
    private final Logger log;
    private final StringBuilder line = new StringBuilder();

    public Slf4jLogWriter(Logger log) {
        this.log = log;
    }

    @Override
    public synchronized void write(char[] cbuf, int off, int len) {
        for (int i = off; i < off + len; i++) {
            char c = cbuf[i];
            if (c == '\n') {
                emit();
            } else if (c != '\r') {
                line.append(c);
            }
        }
    }

    @Override
    public synchronized void flush() {
        emit();
    }

    @Override
    public void close() {
        flush();
    }

    private void emit() {
        if (line.length() > 0) {
            log.info(line.toString());
            line.setLength(0);
        }
    }
}
