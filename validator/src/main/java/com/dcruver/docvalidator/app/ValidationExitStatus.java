package com.dcruver.docvalidator.app;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process exit status of the last command: 0 clean, 1 blocking findings, 2 invalid invocation.
 */
@Component
public class ValidationExitStatus implements ExitCodeGenerator {

    public static final int INVALID_INVOCATION = 2;

    private final AtomicInteger status = new AtomicInteger(0);

    public void set(int exitCode) {
        status.set(exitCode);
    }

    @Override
    public int getExitCode() {
        return status.get();
    }
}
