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

import java.math.BigInteger;
import java.util.Objects;

/**
 * The result of a primality test.
 *
 * @author Tilman Neumann
 */
public final class PrimalityResult {
	private final BigInteger n;
	private final boolean probablePrime;
	private final BigInteger witness;
	private final BigInteger divisor;

	/**
	 * Full constructor.
	 * @param n the tested number, with its original sign
	 * @param probablePrime true if n passed all tests
	 * @param witness a witness for the compositeness of n, or null
	 * @param divisor a non-trivial divisor of n, or null
	 */
	public PrimalityResult(BigInteger n, boolean probablePrime, BigInteger witness, BigInteger divisor) {
		this.n = Objects.requireNonNull(n);
		this.probablePrime = probablePrime;
		this.witness = witness;
		this.divisor = divisor;
	}

	static PrimalityResult probablePrime(BigInteger n) {
		return new PrimalityResult(n, true, null, null);
	}

	static PrimalityResult composite(BigInteger n, BigInteger witness, BigInteger divisor) {
		return new PrimalityResult(n, false, witness, divisor);
	}

	/**
	 * @return the tested number, with its original sign
	 */
	public BigInteger getN() {
		return n;
	}

	public boolean isProbablePrime() {
		return probablePrime;
	}

	/**
	 * @return a base proving that n is composite, or null
	 */
	public BigInteger getWitness() {
		return witness;
	}

	/**
	 * @return a non-trivial divisor of n, or null if none was found
	 */
	public BigInteger getDivisor() {
		return divisor;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof PrimalityResult)) return false;
		PrimalityResult other = (PrimalityResult) o;
		return probablePrime == other.probablePrime && n.equals(other.n) && Objects.equals(witness, other.witness) && Objects.equals(divisor, other.divisor);
	}

	@Override
	public int hashCode() {
		return Objects.hash(n, probablePrime, witness, divisor);
	}

	@Override
	public String toString() {
		return "PrimalityResult(n=" + n + ", probablePrime=" + probablePrime + ", witness=" + witness + ", divisor=" + divisor + ")";
	}
}
