package com.fxtrader.bot;

import com.fxtrader.core.notify.ProcessControl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Restart by re-executing the current JVM command line, halt by exiting.
 */
public final class JvmProcessControl implements ProcessControl {
    private static final Logger logger = LoggerFactory.getLogger(JvmProcessControl.class);

    static final int EXIT_RESTART = 0;
    static final int EXIT_HALT = 3;

    @Override
    public void restart() {
        var info = ProcessHandle.current().info();
        if (info.command().isEmpty()) {
            logger.error("🚨 Cannot determine the JVM command line, halting instead of restarting");
            halt("restart impossible: unknown command line");
            return;
        }
        List<String> command = new ArrayList<>();
        command.add(info.command().get());
        info.arguments().ifPresent(args -> command.addAll(List.of(args)));
        try {
            new ProcessBuilder(command).inheritIO().start();
            logger.warn("🔁 Replacement process started, exiting");
            System.exit(EXIT_RESTART);
        } catch (IOException e) {
            logger.error("🚨 Re-exec failed", e);
            halt("restart failed: " + e.getMessage());
        }
    }

    @Override
    public void halt(String reason) {
        logger.error("🛑 Halting: {}", reason);
        System.exit(EXIT_HALT);
    }
}
