package com.my.calsync.domain.port.out;

import java.time.Instant;
import java.util.Optional;

/**
 * 왜: 인가 요청의 state 값을 사용자에 묶어 두고 콜백에서 한 번만 소비하게 하여 CSRF 를 막기 위함.
 */
public interface OAuthStatePort {

    void save(String state, String userId, Instant createdAt);

    /**
     * state 를 삭제하고, issuedAfter 이후에 발급된 것이면 묶인 사용자 id 를 돌려준다.
     */
    Optional<String> consume(String state, Instant issuedAfter);
}
