package com.pulseboard.customer.repository;

import com.pulseboard.customer.entity.CustomerEntity;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CustomerRepository extends JpaRepository<CustomerEntity, Long> {

    List<CustomerEntity> findByOrdersCountGreaterThan(int ordersCount);

    long countByCreatedAtGreaterThanEqual(OffsetDateTime createdAt);

    Optional<CustomerEntity> findFirstByEmail(String email);

    @Query("select c.createdAt from CustomerEntity c where c.createdAt >= :since")
    List<OffsetDateTime> findCreatedAtSince(@Param("since") OffsetDateTime since);

    @Query("""
        select c from CustomerEntity c
        where lower(c.email) like lower(concat('%', :query, '%'))
           or lower(c.firstName) like lower(concat('%', :query, '%'))
           or lower(c.lastName) like lower(concat('%', :query, '%'))
        order by c.totalSpent desc
        """)
    List<CustomerEntity> search(@Param("query") String query, Pageable pageable);
}
