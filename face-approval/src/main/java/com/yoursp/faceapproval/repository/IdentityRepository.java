package com.yoursp.faceapproval.repository;

import com.yoursp.faceapproval.model.entity.Identity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface IdentityRepository extends JpaRepository<Identity, UUID> {

    Optional<Identity> findByName(String name);

    boolean existsByName(String name);

    /** Enrollment order, which the matcher relies on for tie-breaking. */
    List<Identity> findAllByOrderByRegisteredAtAscIdAsc();

    @Modifying
    @Transactional
    long deleteByName(String name);

    /**
     * Metadata-only update; the embedding column is never part of this statement.
     */
    @Modifying
    @Transactional
    @Query("UPDATE Identity i SET i.name = :newName, i.groupName = :groupName, i.rollId = :rollId "
            + "WHERE i.name = :oldName")
    int updateMetadata(@Param("oldName") String oldName, @Param("newName") String newName,
            @Param("groupName") String groupName, @Param("rollId") String rollId);
}
