package com.example.actionlambda.core.error;

/** Tag identifying which failure variant a {@link ClassifiedException} represents. */
public enum ErrorKind {
  /** Failure raised outside the database layer with caller-supplied policy flags. */
  GENERAL,
  /** Any database failure that is not a lock wait timeout or deadlock. */
  DATABASE,
  /** Lock wait timeout or deadlock that persisted through every internal retry attempt. */
  DATABASE_LOCK
}
