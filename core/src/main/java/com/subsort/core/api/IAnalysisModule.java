package com.subsort.core.api;

import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.scanner.ModuleContext;

import java.util.List;

/**
 * 분석 모듈 최소 계약: 공유 응답(+필요 시 추가 왕복)을 받아 선언 필드의 기여분을 돌려준다.
 * analyze가 던지는 모든 예외는 해당 모듈의 실패로만 기록되고 호스트는 계속 진행된다.
 */
public interface IAnalysisModule {

    int PRIORITY_EXTENDED = 100;

    /** 설정/CLI에서 쓰는 소문자 이름 */
    String name();

    /** 작을수록 먼저 실행. 같은 값이면 이름순 */
    default int priority() { return PRIORITY_EXTENDED; }

    /** 선언 필드(출력 스키마 키). 모듈 간 중복 금지 */
    List<String> fields();

    PartialRecord analyze(HttpResponseData response, ModuleContext ctx) throws Exception;
}
