/*
 * montgomery-primality is a Miller-Rabin probable prime test working in Montgomery form.
 * Copyright (C) 2018 Tilman Neumann - tilman.neumann@web.de
 *
 * This program is free software; you can redistribute it and/or modify it under the terms of the GNU General Public License
 * as published by the Free Software Foundation; either version 3 of the License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along with this program;
 * if not, see <http://www.gnu.org/licenses/>.
 */
package de.tilman_neumann.primality.probable;

import static org.junit.Assert.*;

import java.math.BigInteger;
import java.util.Random;

import org.junit.Test;

import de.tilman_neumann.primality.base.InputFormatException;
import de.tilman_neumann.primality.random.RandomBitSource;
import de.tilman_neumann.primality.random.Rng;

/**
 * Verdicts, witnesses and divisors of the Miller-Rabin test for known primes and composites.
 */
public class MillerRabinResultsTest {

	private static final RandomBitSource NO_RANDOMNESS = numBits -> {
		throw new AssertionError("no random bits expected");
	};

	private final MillerRabinTest mr = new MillerRabinTest(new Rng(20180101L));

	private static BigInteger big(String s) {
		return new BigInteger(s);
	}

	private static BigInteger mersenne(int exponent) {
		return BigInteger.ONE.shiftLeft(exponent).subtract(BigInteger.ONE);
	}

	private void assertProbablePrime(BigInteger p) {
		PrimalityResult result = mr.test(p);
		assertTrue(p + " should be a probable prime", result.isProbablePrime());
		assertNull(result.getWitness());
		assertNull(result.getDivisor());
		assertEquals(p, result.getN());
	}

	private void assertComposite(BigInteger n) {
		PrimalityResult result = mr.test(n);
		assertFalse(n + " should be composite", result.isProbablePrime());
		assertNotNull(result.getWitness());
		assertValidDivisor(n, result.getDivisor());
	}

	private static void assertValidDivisor(BigInteger n, BigInteger divisor) {
		if (divisor != null) {
			assertEquals(BigInteger.ZERO, n.mod(divisor));
			assertNotEquals(BigInteger.ONE, divisor);
			assertNotEquals(n.abs(), divisor);
		}
	}

	@Test
	public void testSmallPrimes() {
		for (int p : new int[] { 2, 3, 5, 7, 11, 13, 17, 19, 23, 29, 31, 37, 41, 43, 47, 53, 59, 61, 67, 71, 73, 79, 83, 89, 97 }) {
			assertProbablePrime(BigInteger.valueOf(p));
		}
	}

	@Test
	public void testSmallOddComposites() {
		for (int n : new int[] { 9, 15, 21, 25, 27, 33, 35, 49, 91 }) {
			assertComposite(BigInteger.valueOf(n));
		}
	}

	@Test
	public void testMediumPrimes() {
		assertProbablePrime(big("3847201213"));
		assertProbablePrime(big("482398747"));
		assertProbablePrime(big("4145835283301077"));
		assertProbablePrime(big("120371948791827323"));
	}

	@Test
	public void testHugePrimes() {
		assertProbablePrime(big("18946997824225017722021425122738127657874530527352426816501085067223"));
		assertProbablePrime(mersenne(521));
		assertProbablePrime(mersenne(607));
	}

	@Test
	public void testLargeComposites() {
		assertComposite(big("565122993"));
		assertComposite(big("6282987234087503937"));
		assertComposite(big("41458352833010723"));
		assertComposite(big("83920982304875092830927350109182130197359081723098365091823916821"));
		assertComposite(mersenne(521).multiply(mersenne(607)));
	}

	@Test
	public void testDivisorsOfComposites() {
		for (String n : new String[] { "14911", "239875", "41612447", "1524157998833865801420881" }) {
			PrimalityResult result = mr.test(n);
			assertFalse(result.isProbablePrime());
			assertValidDivisor(big(n), result.getDivisor());
		}
	}

	@Test
	public void testSquareOfPrimeYieldsThePrime() {
		for (String p : new String[] { "101", "1203981240941", "7382749857293847288803" }) {
			BigInteger prime = big(p);
			PrimalityResult result = mr.test(prime.multiply(prime));
			assertFalse(result.isProbablePrime());
			assertEquals(prime, result.getDivisor());
		}
	}

	@Test
	public void testEvenNumbers() {
		MillerRabinTest noRandomness = new MillerRabinTest(NO_RANDOMNESS);
		for (BigInteger n : new BigInteger[] { BigInteger.valueOf(4), BigInteger.valueOf(10), BigInteger.valueOf(8327982), BigInteger.ONE.shiftLeft(100) }) {
			PrimalityResult result = noRandomness.test(n);
			assertFalse(result.isProbablePrime());
			assertNull(result.getWitness());
			assertEquals(BigInteger.TWO, result.getDivisor());
		}
	}

	@Test
	public void testTrivialCases() {
		MillerRabinTest noRandomness = new MillerRabinTest(NO_RANDOMNESS);
		assertEquals(new PrimalityResult(BigInteger.ZERO, false, null, null), noRandomness.test(0));
		assertEquals(new PrimalityResult(BigInteger.ONE, false, null, null), noRandomness.test(1));
		assertEquals(new PrimalityResult(BigInteger.TWO, true, null, null), noRandomness.test(2));
		assertEquals(new PrimalityResult(BigInteger.valueOf(3), true, null, null), noRandomness.test(3));
	}

	@Test
	public void testNegativeNumbersKeepTheirSign() {
		PrimalityResult prime = mr.test(-7);
		assertTrue(prime.isProbablePrime());
		assertEquals(BigInteger.valueOf(-7), prime.getN());

		PrimalityResult composite = mr.test(-91, PrimalityTestOptions.builder().bases(23).build());
		assertEquals(new PrimalityResult(BigInteger.valueOf(-91), false, BigInteger.valueOf(23), BigInteger.valueOf(7)), composite);

		PrimalityResult even = mr.test("-10");
		assertEquals(BigInteger.valueOf(-10), even.getN());
		assertEquals(BigInteger.TWO, even.getDivisor());
	}

	@Test
	public void testInputTypes() {
		assertFalse(mr.test(8327981).isProbablePrime());
		assertTrue(mr.test(8327983).isProbablePrime());
		assertFalse(mr.test("8327981").isProbablePrime());
		assertTrue(mr.test("8327983").isProbablePrime());
		assertFalse(mr.test(8327981L).isProbablePrime());
		assertTrue(mr.test(BigInteger.valueOf(8327983)).isProbablePrime());
		assertEquals(BigInteger.valueOf(8327983), mr.test("8327983").getN());
	}

	@Test(expected = InputFormatException.class)
	public void testMalformedInput() {
		mr.test("83279x3");
	}

	@Test(expected = InputFormatException.class)
	public void testUnsupportedInputType() {
		mr.test(new Object());
	}

	@Test
	public void testAgreesWithBigIntegerOnPrimes() {
		Random rnd = new Random(4711);
		for (int i = 0; i < 300; i++) {
			BigInteger n = new BigInteger(5 + rnd.nextInt(300), rnd).setBit(0);
			PrimalityResult result = mr.test(n);
			if (n.isProbablePrime(50)) {
				assertTrue(n + " is prime", result.isProbablePrime());
			} else if (!result.isProbablePrime()) {
				assertValidDivisor(n, result.getDivisor());
			}
		}
	}

	@Test
	public void testDeterministicBasesAgreeWithBigInteger() {
		// the first 12 primes as bases give a deterministic test far beyond this range
		PrimalityTestOptions options = PrimalityTestOptions.builder().bases(2, 3, 5, 7, 11, 13, 17, 19, 23, 29, 31, 37).build();
		MillerRabinTest deterministic = new MillerRabinTest(NO_RANDOMNESS);
		for (int n = 41; n < 20000; n += 2) {
			BigInteger N = BigInteger.valueOf(n);
			PrimalityResult result = deterministic.test(N, options);
			assertEquals("n = " + n, N.isProbablePrime(50), result.isProbablePrime());
			assertValidDivisor(N, result.getDivisor());
		}
	}
}
