package org.voteledger.voter;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Lob;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import org.eclipse.microprofile.graphql.Ignore;
import org.voteledger.model.BaseEntity;

import java.util.List;
import java.util.Optional;

/**
 * A voter. Created once, when the voter registers for their first election.
 * The biometric template is stored here and never replaced.
 */
@Data
@NoArgsConstructor(force = true)
@EqualsAndHashCode(of = {}, callSuper = true)
@Entity(name = "voters")
public class VoterEntity extends BaseEntity {

	/** external identifier of the voter, e.g. a university enrollment number */
	@NotNull
	@lombok.NonNull
	@Column(unique = true, nullable = false)
	String enrollment;

	@NotNull
	@lombok.NonNull
	String name;

	/** encoded face embedding. Never leaves the backend. */
	@Lob
	@JsonIgnore
	@Ignore
	@Column(nullable = false, length = 1048576)   // MEDIUMBLOB on MySQL
	byte[] biometricTemplate;

	public VoterEntity(@lombok.NonNull String enrollment, @lombok.NonNull String name, byte[] biometricTemplate) {
		this.enrollment = enrollment;
		this.name = name;
		this.biometricTemplate = biometricTemplate;
	}

	public static Optional<VoterEntity> findByEnrollment(String enrollment) {
		return VoterEntity.find("enrollment", enrollment).firstResultOptional();
	}

	public static List<VoterEntity> listAllByEnrollment() {
		return VoterEntity.list("order by enrollment");
	}

	@Override
	public String toString() {
		// never print the template
		return "VoterEntity[id=" + id + ", name='" + name + "']";
	}
}
