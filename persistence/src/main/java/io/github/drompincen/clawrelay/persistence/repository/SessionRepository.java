package io.github.drompincen.clawrelay.persistence.repository;

import io.github.drompincen.clawrelay.persistence.document.SessionDocument;
import io.github.drompincen.clawrelay.protocol.api.SessionStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface SessionRepository extends MongoRepository<SessionDocument, String> {
    List<SessionDocument> findByStatus(SessionStatus status);
    Optional<SessionDocument> findBySessionId(String sessionId);
}
