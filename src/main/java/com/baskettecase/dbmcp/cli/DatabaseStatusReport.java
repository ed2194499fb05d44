package com.baskettecase.dbmcp.cli;

import com.baskettecase.dbmcp.service.ConnectionSummary;
import com.baskettecase.dbmcp.service.DatabaseStatus;
import com.baskettecase.dbmcp.service.QueryExecutor;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Map;

/**
 * Prints database availability for the {@code --list-databases} and {@code --test} modes.
 * Does nothing when the server is started normally.
 */
@Component
@RequiredArgsConstructor
public class DatabaseStatusReport implements CommandLineRunner {

    private final QueryExecutor queryExecutor;

    @Override
    public void run(String... args) {
        if (!CommandLineMode.isListingMode(args)) {
            return;
        }
        print(CommandLineMode.fromArgs(args), queryExecutor.listDatabases(), System.out);
    }

    void print(CommandLineMode mode, Map<String, DatabaseStatus> statuses, PrintStream out) {
        if (mode == CommandLineMode.TEST) {
            out.println("🔍 Testing connections...");
        } else {
            out.println("Available databases:");
        }

        int working = 0;
        for (Map.Entry<String, DatabaseStatus> entry : statuses.entrySet()) {
            DatabaseStatus status = entry.getValue();
            out.printf("  %s %s%n", status.isAvailable() ? "✅" : "❌", entry.getKey());
            if (status.isAvailable()) {
                working++;
                ConnectionSummary config = status.getConnectionConfig();
                out.printf("      └─ %s / %s%n", config.getHost(), config.getDatabase());
            } else {
                out.printf("      └─ Error: %s%n", status.getError() != null ? status.getError() : "Unknown error");
            }
        }

        if (mode == CommandLineMode.TEST) {
            out.printf("%n📊 Result: %d/%d connections working%n", working, statuses.size());
        } else {
            out.printf("%nTotal: %d%n", statuses.size());
        }
    }
}
