package com.watchwise.backend.users.user.repo;

import com.watchwise.backend.users.user.entity.User;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface UserRepo extends JpaRepository<User, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from User u where u.id = :id")
    User findByIdForUpdate(@Param("id") Long id);

    @Query("""
            select u from User u
             where u.userType = com.watchwise.backend.users.user.entity.User.UserType.CHILD
               and u.status = 'ACTIVE'
               and u.lastActiveAt < :cutoff
             order by u.id asc
            """)
    List<User> findInactiveChildren(@Param("cutoff") Instant cutoff, Pageable page);
}
