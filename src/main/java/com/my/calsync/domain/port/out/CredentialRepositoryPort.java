package com.my.calsync.domain.port.out;

import com.my.calsync.domain.model.OAuthCredential;

import java.util.List;
import java.util.Optional;

/**
 * 왜: 자격 증명 영속화를 추상화해 CredentialStore 가 저장 기술에 의존하지 않도록 하기 위함.
 */
public interface CredentialRepositoryPort {

    Optional<OAuthCredential> find(String userId, String provider);

    List<OAuthCredential> findByUser(String userId);

    /**
     * (userId, provider) 기준 upsert.
     */
    void save(OAuthCredential credential);

    boolean delete(String userId, String provider);
}
