package com.subsort.core.config;

/** 스캔 시작 전에 거부되는 설정 오류(잘못된 값, 알 수 없는 모듈, 필드 충돌). 배치 전체를 중단시킨다. */
public class ConfigException extends IllegalArgumentException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
