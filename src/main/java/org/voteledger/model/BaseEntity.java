package org.voteledger.model;

import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import lombok.EqualsAndHashCode;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Base class for the mutable rows of the local cache: elections, voters and registrations.
 * Each entity by default has a createdAt and updatedAt that is automatically filled on save.
 *
 * Vote receipts do NOT extend this class. They are immutable and keyed by the ledger's receiptId.
 *
 * <h3>Equality</h3>
 * By default, entities are considered to be equal if and only if their ID is set and the same.
 * Two not yet persisted entities are *not* equal, even if they share the same data.
 */
@MappedSuperclass  // This JPA class does not have a DB table itself. Only its "mapped" superclasses have.
public class BaseEntity extends PanacheEntity {

	@CreationTimestamp
	@Column(nullable = false, updatable = false)
	public LocalDateTime createdAt;

	@UpdateTimestamp
	@Column(nullable = false)
	public LocalDateTime updatedAt;

	@EqualsAndHashCode.Include
	public Long getId() {
		return this.id;
	}

	/*
	 * Two BaseEntities are equal when their ID field is not null and has the same value
	 */
	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		BaseEntity other = (BaseEntity) obj;
		return id != null && id.equals(other.id);
	}

	@Override
	public int hashCode() {
		return id != null ? id.hashCode() : 0;
	}
}
