package com.linlay.carassist.storage;

import com.linlay.carassist.support.SqliteFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.UncategorizedSQLException;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcStorageGatewayTest {

    @TempDir
    Path tempDir;

    private final JdbcStorageGateway gateway = new JdbcStorageGateway();
    private SqliteFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = SqliteFixture.create(tempDir)
                .car(1, "1HGCM82633A004352", 2003, "Honda", "Accord", 120000)
                .car(2, "2T1BURHE0JC014000", 2018, "Toyota", "Corolla", 40000)
                .car(3, "5YJ3E1EA7KF317000", 2019, "Tesla", "Model 3", 30000);
    }

    @Test
    void rowsShouldComeBackAsOrderedMaps() {
        Map<String, Object> row = gateway.execute(fixture.descriptor(), storage -> storage.findById(Table.CARS, 1L))
                .orElseThrow();

        assertThat(row).containsEntry("vin", "1HGCM82633A004352");
        assertThat(row.keySet()).startsWith("id", "vin", "year", "make", "model");
    }

    @Test
    void fuzzyLookupShouldMatchCaseInsensitiveSubstring() {
        List<Map<String, Object>> rows = gateway.execute(fixture.descriptor(),
                storage -> storage.findBy(Table.CARS, "make", "hon", true));

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0)).containsEntry("model", "Accord");
    }

    @Test
    void exactLookupShouldNotMatchSubstring() {
        List<Map<String, Object>> rows = gateway.execute(fixture.descriptor(),
                storage -> storage.findBy(Table.CARS, "vin", "1HGCM", false));

        assertThat(rows).isEmpty();
    }

    @Test
    void unknownColumnShouldBeRejectedBeforeQuerying() {
        assertThatThrownBy(() -> gateway.execute(fixture.descriptor(),
                storage -> storage.findBy(Table.CARS, "vin; DROP TABLE cars", "x", false)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(((Number) fixture.query("SELECT COUNT(*) AS n FROM cars").get(0).get("n")).intValue()).isEqualTo(3);
    }

    @Test
    void insertAndUpdateShouldPersistWithinOneCall() {
        gateway.execute(fixture.descriptor(), storage -> {
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("id", -1L);
            values.put("vin", "NEWVIN0000000001");
            values.put("make", "Ford");
            storage.insert(Table.CARS, values);
            return storage.updateColumn(Table.CARS, -1L, "mileage", 1234);
        });

        Map<String, Object> row = fixture.query("SELECT * FROM cars WHERE id = -1").get(0);
        assertThat(row).containsEntry("make", "Ford");
        assertThat(((Number) row.get("mileage")).intValue()).isEqualTo(1234);
        assertThat(gateway.<Long>execute(fixture.descriptor(), storage -> storage.minId(Table.CARS))).isEqualTo(-1L);
    }

    @Test
    void failedWorkShouldRollBack() {
        assertThatThrownBy(() -> gateway.execute(fixture.descriptor(), storage -> {
            storage.updateColumn(Table.CARS, 1L, "mileage", 1);
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(((Number) fixture.query("SELECT mileage FROM cars WHERE id = 1").get(0).get("mileage")).intValue())
                .isEqualTo(120000);
    }

    @Test
    void blankDescriptorShouldBeUnavailable() {
        assertThatThrownBy(() -> gateway.execute(" ", storage -> storage.findAll(Table.CARS)))
                .isInstanceOfSatisfying(StorageException.class,
                        ex -> assertThat(ex.category()).isEqualTo(StorageException.Category.UNAVAILABLE));
    }

    @Test
    void translateShouldClassifyDriverFailures() {
        assertThat(JdbcStorageGateway.translate(new DuplicateKeyException("dup")).category())
                .isEqualTo(StorageException.Category.UNIQUE_VIOLATION);
        assertThat(JdbcStorageGateway.translate(new UncategorizedSQLException("insert", "INSERT",
                new SQLException("[SQLITE_CONSTRAINT_FOREIGNKEY] FOREIGN KEY constraint failed"))).category())
                .isEqualTo(StorageException.Category.INTEGRITY_VIOLATION);
        assertThat(JdbcStorageGateway.translate(new UncategorizedSQLException("insert", "INSERT",
                new SQLException("UNIQUE constraint failed: cars.vin"))).category())
                .isEqualTo(StorageException.Category.UNIQUE_VIOLATION);
        assertThat(JdbcStorageGateway.translate(new UncategorizedSQLException("select", "SELECT",
                new SQLException("no such table: cars"))).category())
                .isEqualTo(StorageException.Category.TRANSACTION_FAILED);
    }
}
