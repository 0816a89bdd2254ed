package com.example.fileshelf.entity;

public enum TransactionAction {
    ADD,
    FINALIZE,
    REMOVE, // marked as deleted, object still in bucket
    RESTORE,
    DELETE, // row and (optionally) object gone
    MODIFY,
    OTHER
}
