package com.linlay.carassist.support;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * File-backed SQLite database with the assistant's four tables.
 */
public final class SqliteFixture {

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE cars (
                id INTEGER PRIMARY KEY,
                vin TEXT UNIQUE,
                year INTEGER,
                make TEXT,
                model TEXT,
                trim TEXT,
                mileage INTEGER,
                interior_condition TEXT,
                exterior_condition TEXT,
                seller_ask_cents INTEGER,
                buyer_offer_cents INTEGER,
                created_at TEXT,
                lead_id INTEGER
            )
            """,
            """
            CREATE TABLE pickup (
                pick_up_id INTEGER PRIMARY KEY,
                car_id INTEGER REFERENCES cars(id),
                address TEXT,
                contact_phone TEXT,
                pick_up_info TEXT,
                created_at TEXT,
                dropoff_time TEXT
            )
            """,
            """
            CREATE TABLE buyers (
                id INTEGER PRIMARY KEY,
                name TEXT
            )
            """,
            """
            CREATE TABLE buyer_schedule (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                buyer_id INTEGER,
                description TEXT,
                schedule_time TEXT,
                priority TEXT
            )
            """
    );

    private final String descriptor;

    private SqliteFixture(String descriptor) {
        this.descriptor = descriptor;
    }

    public static SqliteFixture create(Path directory) {
        SqliteFixture fixture = new SqliteFixture(directory.resolve("assistant.db").toAbsolutePath().toString());
        SCHEMA.forEach(fixture::execute);
        return fixture;
    }

    /**
     * Plain file path, the way sessions carry it.
     */
    public String descriptor() {
        return descriptor;
    }

    public SqliteFixture car(long id, String vin, int year, String make, String model, int mileage) {
        execute("INSERT INTO cars (id, vin, year, make, model, mileage) VALUES (?, ?, ?, ?, ?, ?)",
                id, vin, year, make, model, mileage);
        return this;
    }

    public SqliteFixture pickup(long pickUpId, long carId, String address, String dropoffTime) {
        execute("INSERT INTO pickup (pick_up_id, car_id, address, dropoff_time) VALUES (?, ?, ?, ?)",
                pickUpId, carId, address, dropoffTime);
        return this;
    }

    public SqliteFixture buyer(long id, String name) {
        execute("INSERT INTO buyers (id, name) VALUES (?, ?)", id, name);
        return this;
    }

    public SqliteFixture schedule(long buyerId, String description, String scheduleTime, String priority) {
        execute("INSERT INTO buyer_schedule (buyer_id, description, schedule_time, priority) VALUES (?, ?, ?, ?)",
                buyerId, description, scheduleTime, priority);
        return this;
    }

    public List<Map<String, Object>> query(String sql, Object... args) {
        SingleConnectionDataSource dataSource = dataSource();
        try {
            return new JdbcTemplate(dataSource).queryForList(sql, args);
        } finally {
            dataSource.destroy();
        }
    }

    public void execute(String sql, Object... args) {
        SingleConnectionDataSource dataSource = dataSource();
        try {
            new JdbcTemplate(dataSource).update(sql, args);
        } finally {
            dataSource.destroy();
        }
    }

    private SingleConnectionDataSource dataSource() {
        return new SingleConnectionDataSource("jdbc:sqlite:" + descriptor, true);
    }
}
