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
package de.tilman_neumann.primality.random;

import static org.junit.Assert.*;

import java.math.BigInteger;

import org.junit.Test;

public class RngTest {

	@Test
	public void testNextBitsRange() {
		Rng rng = new Rng();
		for (int numBits = 0; numBits < 300; numBits++) {
			BigInteger x = rng.nextBits(numBits);
			assertTrue(x.signum() >= 0);
			assertTrue(x.bitLength() <= numBits);
		}
	}

	@Test
	public void testSeededRngIsReproducible() {
		Rng rng1 = new Rng(2018L);
		Rng rng2 = new Rng(2018L);
		for (int i = 0; i < 50; i++) {
			assertEquals(rng1.nextBits(100 + i), rng2.nextBits(100 + i));
		}
	}

	@Test
	public void testNextBigInteger() {
		Rng rng = new Rng(1L);
		BigInteger min = BigInteger.valueOf(2);
		BigInteger max = BigInteger.valueOf(89);
		boolean minSeen = false, maxSeen = false;
		for (int i = 0; i < 5000; i++) {
			BigInteger x = rng.nextBigInteger(min, max);
			assertTrue(x.compareTo(min) >= 0 && x.compareTo(max) <= 0);
			minSeen |= x.equals(min);
			maxSeen |= x.equals(max);
		}
		assertTrue(minSeen && maxSeen);
		assertEquals(min, rng.nextBigInteger(min, min));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeNumBits() {
		new Rng().nextBits(-1);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyRange() {
		new Rng().nextBigInteger(BigInteger.TEN, BigInteger.ONE);
	}
}
