package com.subsort.core.scanner;

/** 모듈 1개의 실패(예산 초과 포함). 호스트 실패로 번지지 않는다. */
public class ModuleException extends Exception {
    public ModuleException(String message) {
        super(message);
    }

    public ModuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
