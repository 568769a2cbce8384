package com.taildeck.backend.modules.identity.domain;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import com.taildeck.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * 외부 ID 제공자(OIDC)의 subject에 대응하는 로컬 사용자.
 * id는 subject로부터 결정적으로 계산되므로 같은 subject는 항상 같은 id를 갖는다.
 */
@Entity
@Table(name = "app_user")
public class AppUser extends AbstractTimestampedEntity {

    private static final String SUBJECT_NAMESPACE = "oidc:";

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "subject", nullable = false, unique = true, updatable = false, length = 255)
    private String subject;

    @Column(name = "email", length = 320)
    private String email;

    @Column(name = "name", length = 255)
    private String name;

    protected AppUser() {
    }

    public AppUser(String subject) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be blank");
        }
        this.subject = subject;
        this.id = idForSubject(subject);
    }

    public static UUID idForSubject(String subject) {
        return UUID.nameUUIDFromBytes((SUBJECT_NAMESPACE + subject).getBytes(StandardCharsets.UTF_8));
    }

    public void updateProfile(String email, String name) {
        this.email = email;
        this.name = name;
    }

    public UUID getId() {
        return id;
    }

    public String getSubject() {
        return subject;
    }

    public String getEmail() {
        return email;
    }

    public String getName() {
        return name;
    }
}
