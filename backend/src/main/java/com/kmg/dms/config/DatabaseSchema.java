package com.kmg.dms.config;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class DatabaseSchema {
    private final JdbcTemplate jdbcTemplate;

    public DatabaseSchema(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void initialize() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS tenants (
              id TEXT PRIMARY KEY,
              code TEXT UNIQUE NOT NULL,
              name TEXT NOT NULL,
              is_active INTEGER NOT NULL DEFAULT 1,
              created_at TEXT NOT NULL
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS employees (
              id TEXT PRIMARY KEY,
              tenant_id TEXT,
              employee_id TEXT NOT NULL,
              first_name TEXT,
              last_name TEXT,
              is_active INTEGER NOT NULL DEFAULT 1,
              created_at TEXT NOT NULL,
              FOREIGN KEY (tenant_id) REFERENCES tenants(id)
            )
            """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS ix_employees_tenant_id ON employees(tenant_id, employee_id)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS employee_aliases (
              employee_ref TEXT NOT NULL,
              alias TEXT NOT NULL,
              PRIMARY KEY (employee_ref, alias),
              FOREIGN KEY (employee_ref) REFERENCES employees(id)
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS document_types (
              id TEXT PRIMARY KEY,
              tenant_id TEXT,
              name TEXT NOT NULL,
              description TEXT,
              category_code TEXT,
              is_subject_specific INTEGER NOT NULL DEFAULT 0,
              created_at TEXT NOT NULL,
              UNIQUE (tenant_id, name),
              FOREIGN KEY (tenant_id) REFERENCES tenants(id)
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS documents (
              id TEXT PRIMARY KEY,
              tenant_id TEXT NOT NULL,
              title TEXT NOT NULL,
              original_filename TEXT NOT NULL,
              file_extension TEXT NOT NULL,
              mime_type TEXT,
              content_ref TEXT NOT NULL,
              file_size INTEGER NOT NULL DEFAULT 0,
              content_hash TEXT NOT NULL,
              status TEXT NOT NULL,
              source TEXT NOT NULL,
              metadata_json TEXT NOT NULL,
              tags_json TEXT NOT NULL,
              employee_id TEXT,
              document_type_id TEXT,
              period_year INTEGER,
              period_month INTEGER,
              notes TEXT,
              created_at TEXT NOT NULL,
              updated_at TEXT NOT NULL,
              FOREIGN KEY (tenant_id) REFERENCES tenants(id),
              FOREIGN KEY (employee_id) REFERENCES employees(id),
              FOREIGN KEY (document_type_id) REFERENCES document_types(id)
            )
            """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS ix_documents_hash ON documents(content_hash)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS processed_records (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              tenant_id TEXT NOT NULL,
              content_hash TEXT NOT NULL,
              source_identifier TEXT NOT NULL,
              document_id TEXT,
              processed_at TEXT NOT NULL,
              UNIQUE (tenant_id, content_hash),
              FOREIGN KEY (tenant_id) REFERENCES tenants(id),
              FOREIGN KEY (document_id) REFERENCES documents(id)
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS scan_jobs (
              id TEXT PRIMARY KEY,
              source TEXT NOT NULL,
              status TEXT NOT NULL,
              total_files INTEGER NOT NULL DEFAULT 0,
              processed_files INTEGER NOT NULL DEFAULT 0,
              skipped_files INTEGER NOT NULL DEFAULT 0,
              error_files INTEGER NOT NULL DEFAULT 0,
              documents_created INTEGER NOT NULL DEFAULT 0,
              current_item TEXT,
              error_message TEXT,
              created_at TEXT NOT NULL,
              started_at TEXT,
              completed_at TEXT
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS matching_rules (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              tenant_id TEXT,
              name TEXT NOT NULL,
              is_active INTEGER NOT NULL DEFAULT 1,
              priority INTEGER NOT NULL DEFAULT 0,
              algorithm TEXT NOT NULL,
              match_pattern TEXT NOT NULL,
              is_case_sensitive INTEGER NOT NULL DEFAULT 0,
              assign_document_type_id TEXT,
              assign_employee_id TEXT,
              assign_tags_json TEXT NOT NULL DEFAULT '[]',
              assign_status TEXT,
              match_count INTEGER NOT NULL DEFAULT 0,
              last_matched_at TEXT,
              created_at TEXT NOT NULL,
              FOREIGN KEY (tenant_id) REFERENCES tenants(id)
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS review_tasks (
              id TEXT PRIMARY KEY,
              document_id TEXT NOT NULL,
              title TEXT NOT NULL,
              description TEXT,
              priority INTEGER NOT NULL DEFAULT 2,
              status TEXT NOT NULL,
              source TEXT NOT NULL,
              created_at TEXT NOT NULL,
              updated_at TEXT NOT NULL,
              completed_at TEXT,
              FOREIGN KEY (document_id) REFERENCES documents(id)
            )
            """);
        // One open task per document.
        jdbcTemplate.execute("""
            CREATE UNIQUE INDEX IF NOT EXISTS ux_review_tasks_open
                ON review_tasks(document_id) WHERE status IN ('OPEN', 'IN_PROGRESS')
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS system_logs (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              created_at TEXT NOT NULL,
              level TEXT NOT NULL,
              source TEXT NOT NULL,
              message TEXT NOT NULL,
              details_json TEXT
            )
            """);
    }
}
