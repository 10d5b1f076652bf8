package com.printdesk.jobcore.integration;

import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Empties every table between tests. Child tables first.
 */
final class IntegrationDatabase {

    private IntegrationDatabase() {}

    static void clean(JdbcTemplate jdbc) {
        jdbc.execute("DELETE FROM change_order_vendor");
        jdbc.execute("DELETE FROM change_order");
        jdbc.execute("DELETE FROM component");
        jdbc.execute("DELETE FROM job");
        jdbc.execute("DELETE FROM master_sequence");
    }
}
