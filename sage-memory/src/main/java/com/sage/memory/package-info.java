/**
 * Research memory: documents, learned source effectiveness, known access failures and session checkpoints.
 * <p>
 * {@link com.sage.memory.InMemoryMemoryStore} serves tests and single-process runs;
 * {@link com.sage.memory.jdbc.JdbcMemoryStore} persists to PostgreSQL. Callers use
 * {@link com.sage.memory.ResilientMemory}, which never lets a storage error escape.
 */
package com.sage.memory;
