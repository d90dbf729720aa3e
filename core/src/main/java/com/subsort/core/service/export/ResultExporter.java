package com.subsort.core.service.export;

import com.subsort.core.model.ScanResult;

import java.io.IOException;
import java.io.Writer;

/** 스캔 결과를 한 가지 형식으로 직렬화하는 책임 (TXT/JSON/CSV) */
public interface ResultExporter {
    /**
     * @param result 입력 순서대로 정렬된 결과(취소 시 부분 결과)
     * @param out    호출자가 열고 닫는 Writer
     */
    void write(ScanResult result, Writer out) throws IOException;
}
