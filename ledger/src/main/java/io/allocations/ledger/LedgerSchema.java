package io.allocations.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the ledger tables from the bundled {@code ledger-schema.sql}. Every statement is guarded with
 * {@code IF NOT EXISTS}, so applying it to an initialized store changes nothing.
 */
public final class LedgerSchema {
    private static final Logger log = LoggerFactory.getLogger(LedgerSchema.class);
    private static final String RESOURCE = "/ledger-schema.sql";

    private LedgerSchema() {}

    public static void apply(DataSource dataSource) throws LedgerException {
        String script = load();
        try (Connection c = dataSource.getConnection(); Statement s = c.createStatement()) {
            int applied = 0;
            for (String statement : script.split(";")) {
                if (statement.isBlank()) continue;
                s.execute(statement.trim());
                applied++;
            }
            log.info("Applied {} ledger schema statements", applied);
        } catch (SQLException e) {
            throw new LedgerUnavailableException("Failed to apply ledger schema", e);
        }
    }

    private static String load() throws LedgerException {
        try (InputStream in = LedgerSchema.class.getResourceAsStream(RESOURCE)) {
            if (in == null) throw new LedgerException("Missing schema resource " + RESOURCE);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LedgerException("Failed to read schema resource " + RESOURCE, e);
        }
    }
}
