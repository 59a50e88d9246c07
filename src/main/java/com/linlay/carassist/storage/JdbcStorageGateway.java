package com.linlay.carassist.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;

@Component
public class JdbcStorageGateway implements StorageGateway {

    private static final Logger log = LoggerFactory.getLogger(JdbcStorageGateway.class);

    @Override
    public <T> T execute(String descriptor, StorageWork<T> work) {
        SingleConnectionDataSource dataSource = open(descriptor);
        try {
            TransactionTemplate transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
            JdbcStorageSession session = new JdbcStorageSession(new JdbcTemplate(dataSource));
            return transactionTemplate.execute(status -> work.run(session));
        } catch (DataAccessException | TransactionException ex) {
            throw translate(ex);
        } finally {
            dataSource.destroy();
        }
    }

    private SingleConnectionDataSource open(String descriptor) {
        StorageDescriptor target;
        try {
            target = StorageDescriptor.parse(descriptor);
        } catch (IllegalArgumentException ex) {
            throw new StorageException(StorageException.Category.UNAVAILABLE, "Could not open database: " + ex.getMessage(), ex);
        }
        SingleConnectionDataSource dataSource = new SingleConnectionDataSource(
                target.jdbcUrl(),
                target.username(),
                target.password(),
                true
        );
        try {
            Connection connection = dataSource.getConnection();
            log.debug("Opened {} storage connection valid={}", target.flavor(), connection.isValid(5));
            return dataSource;
        } catch (SQLException | RuntimeException ex) {
            dataSource.destroy();
            throw new StorageException(StorageException.Category.UNAVAILABLE, "Could not open database: " + ex.getMessage(), ex);
        }
    }

    static StorageException translate(RuntimeException ex) {
        String detail = messageOf(ex);
        if (ex instanceof DuplicateKeyException) {
            return new StorageException(StorageException.Category.UNIQUE_VIOLATION, detail, ex);
        }
        if (ex instanceof DataIntegrityViolationException) {
            return new StorageException(StorageException.Category.INTEGRITY_VIOLATION, detail, ex);
        }
        if (ex instanceof DataAccessResourceFailureException || ex instanceof CannotCreateTransactionException) {
            return new StorageException(StorageException.Category.UNAVAILABLE, detail, ex);
        }
        // SQLite errors are not classified by Spring's translators
        String lower = detail.toLowerCase(Locale.ROOT);
        if (lower.contains("unique")) {
            return new StorageException(StorageException.Category.UNIQUE_VIOLATION, detail, ex);
        }
        if (lower.contains("foreign key") || lower.contains("integrity") || lower.contains("constraint")) {
            return new StorageException(StorageException.Category.INTEGRITY_VIOLATION, detail, ex);
        }
        return new StorageException(StorageException.Category.TRANSACTION_FAILED, detail, ex);
    }

    private static String messageOf(RuntimeException ex) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = cause.getMessage();
        return message == null ? cause.getClass().getSimpleName() : message;
    }
}
