package io.b2mash.b2b.reportengine.member;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MemberRepository extends JpaRepository<Member, UUID> {

  Optional<Member> findByOrganizationIdAndExternalUserId(
      String organizationId, String externalUserId);
}
