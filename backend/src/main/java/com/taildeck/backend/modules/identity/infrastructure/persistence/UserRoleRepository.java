package com.taildeck.backend.modules.identity.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.taildeck.backend.modules.identity.domain.UserRole;
import com.taildeck.backend.modules.rbac.domain.RoleName;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserRoleRepository extends JpaRepository<UserRole, UUID> {

    @Query("""
            select ur
              from UserRole ur
             where ur.user.id = :userId
             order by ur.createdAt asc
            """)
    List<UserRole> findByUserId(@Param("userId") UUID userId);

    @Query("select count(ur) from UserRole ur where ur.roleName = :roleName")
    long countByRoleName(@Param("roleName") RoleName roleName);

    /**
     * 해당 역할 보유자가 한 명도 없을 때만 행을 추가한다. 추가된 행 수(0 또는 1)를 반환한다.
     */
    @Modifying
    @Query(value = """
            insert into user_role (id, user_id, role_name, source, created_at, updated_at)
            select cast(:id as uuid), cast(:userId as uuid), r.name, cast(:source as varchar(16)),
                   cast(:now as timestamp with time zone), cast(:now as timestamp with time zone)
              from role r
             where r.name = :roleName
               and not exists (select 1 from user_role ur where ur.role_name = r.name)
            """, nativeQuery = true)
    int insertIfNoHolder(@Param("id") UUID id,
                         @Param("userId") UUID userId,
                         @Param("roleName") String roleName,
                         @Param("source") String source,
                         @Param("now") OffsetDateTime now);
}
