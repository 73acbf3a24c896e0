package org.voteledger.vote;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
public class EnrollmentHasherTest {

	@Inject
	EnrollmentHasher hasher;

	@Test
	public void knownHash() {
		assertEquals("0xd17023e35115bb25d1ceaccf3813404d525e2ecc32d4643a4a371b26d00ac694", hasher.enrollmentHash("E100", 3));
		assertEquals("0xd17023e3", hasher.visibleTag(hasher.enrollmentHash("E100", 3)));
	}

	@Test
	public void deterministic() {
		assertEquals(hasher.enrollmentHash("E100", 3), hasher.enrollmentHash("E100", 3));
	}

	@Test
	public void distinctPerElection() {
		Set<String> hashes = new HashSet<>();
		for (long electionId = 1; electionId <= 100; electionId++) {
			assertTrue(hashes.add(hasher.enrollmentHash("E100", electionId)), "Collision for election " + electionId);
		}
		assertNotEquals(hasher.enrollmentHash("E1", 13), hasher.enrollmentHash("E11", 3));
	}

	@Test
	public void hashDoesNotContainEnrollment() {
		String hash = hasher.enrollmentHash("E100", 3);
		assertTrue(hash.matches("0x[0-9a-f]{64}"));
		assertFalse(hash.contains("E100"));
	}
}
