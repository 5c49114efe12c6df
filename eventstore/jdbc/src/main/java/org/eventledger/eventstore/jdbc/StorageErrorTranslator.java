/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventledger.eventstore.jdbc;

import org.eventledger.eventstore.api.EventStoreException;
import org.eventledger.eventstore.api.FatalStorageException;
import org.eventledger.eventstore.api.TransientStorageException;
import org.jspecify.annotations.Nullable;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;

import java.sql.SQLException;

/**
 * Translates Spring's {@link DataAccessException} and {@link TransactionException} hierarchies into
 * {@link TransientStorageException} (safe to retry) and {@link FatalStorageException} (not retried).
 */
public class StorageErrorTranslator {

    public static boolean isStorageError(Throwable e) {
        return e instanceof DataAccessException || e instanceof TransactionException;
    }

    public static boolean isTransient(Throwable e) {
        return e instanceof TransientDataAccessException
                || e instanceof RecoverableDataAccessException
                || e instanceof DataAccessResourceFailureException
                || e instanceof TransactionTimedOutException
                || e instanceof CannotCreateTransactionException
                || (e instanceof UncategorizedSQLException uncategorized && isTransientSqlState(uncategorized.getSQLException()));
    }

    // 08 = connection exception, 40 = transaction rollback, 57014 = query canceled (statement timeout)
    private static boolean isTransientSqlState(@Nullable SQLException e) {
        String sqlState = e == null ? null : e.getSQLState();
        return sqlState != null && (sqlState.startsWith("08") || sqlState.startsWith("40") || sqlState.equals("57014"));
    }

    /**
     * @param operation A short description of the failed operation, used in the exception message
     * @param e         The exception to translate
     * @return An {@link EventStoreException} if {@code e} is a storage error, otherwise {@code e} itself
     */
    public static RuntimeException translate(String operation, RuntimeException e) {
        if (!isStorageError(e)) {
            return e;
        } else if (isTransient(e)) {
            return new TransientStorageException(operation + " failed with a transient storage error, it's safe to retry", e);
        } else {
            return new FatalStorageException(operation + " failed", e);
        }
    }
}
