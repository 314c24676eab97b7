package io.pipeguard.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        configureLogging();
        int code = PipeguardCommand.newCommandLine(new PipeguardCommand()).execute(args);
        System.exit(code);
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Failed to load logging.properties: " + e.getMessage());
        }
    }
}
