package com.len.kitchen.common.exception;

public class StorageFailureException extends BusinessException {

    public StorageFailureException(Throwable cause) {
        super(ErrorCode.STORAGE_FAILURE, ErrorCode.STORAGE_FAILURE.getMessage(), cause);
    }
}
