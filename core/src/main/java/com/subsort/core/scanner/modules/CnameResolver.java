package com.subsort.core.scanner.modules;

import java.time.Duration;
import java.util.List;

/** CNAME 체인 추적용 DNS 질의 계약(테스트에서 대체) */
public interface CnameResolver {

    enum Status { CNAME, NO_CNAME, NXDOMAIN, ERROR }

    /** target은 CNAME일 때만, 끝 점 제거 */
    record Answer(Status status, String target) {
        public static Answer cname(String target) { return new Answer(Status.CNAME, target); }
        public static Answer of(Status status) { return new Answer(status, null); }
    }

    Answer cname(String name, Duration timeout);

    /** A 레코드(문자열 IP). 실패/없음이면 빈 목록 */
    List<String> addresses(String name, Duration timeout);
}
