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

import java.lang.reflect.Array;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import de.tilman_neumann.primality.base.BigIntResolver;
import de.tilman_neumann.primality.base.InputFormatException;

/**
 * Options of the Miller-Rabin test:
 * <ul>
 * <li><code>numRounds</code>: the number of random bases to test. If null or not positive, a number suitable for the size of N is chosen.</li>
 * <li><code>bases</code>: explicit bases to test, one round per base. If given, numRounds is ignored. Every base must lie in [2, N-2].</li>
 * <li><code>findDivisor</code>: if true (default), try to find a divisor of N where that is cheap.</li>
 * </ul>
 *
 * Instances are immutable; use the builder or read them from a Map or Properties.
 *
 * @author Tilman Neumann
 */
public final class PrimalityTestOptions {
	public static final String NUM_ROUNDS = "numRounds";
	public static final String BASES = "bases";
	public static final String FIND_DIVISOR = "findDivisor";

	/** adaptive number of rounds, random bases, findDivisor=true */
	public static final PrimalityTestOptions DEFAULT = builder().build();

	private final Integer numRounds;
	private final List<BigInteger> bases;
	private final boolean findDivisor;

	private PrimalityTestOptions(Builder builder) {
		this.numRounds = builder.numRounds;
		this.bases = builder.bases != null ? Collections.unmodifiableList(new ArrayList<>(builder.bases)) : null;
		this.findDivisor = builder.findDivisor;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return the requested number of random-base rounds, or null if it shall be chosen automatically
	 */
	public Integer getNumRounds() {
		return numRounds;
	}

	/**
	 * @return explicit bases, or null if random bases shall be used
	 */
	public List<BigInteger> getBases() {
		return bases;
	}

	public boolean isFindDivisor() {
		return findDivisor;
	}

	/**
	 * Read options from properties. Missing keys keep their defaults.
	 * @param props
	 * @return options
	 */
	public static PrimalityTestOptions fromProperties(Properties props) {
		Map<String, Object> map = new HashMap<>();
		for (String key : props.stringPropertyNames()) {
			map.put(key, props.getProperty(key));
		}
		return fromMap(map);
	}

	/**
	 * Read options from a map with the keys "numRounds", "bases" and "findDivisor".
	 * Missing keys or null values keep their defaults; unknown keys are ignored.
	 *
	 * @param map
	 * @return options
	 * @throws InputFormatException if numRounds, findDivisor or some base can not be interpreted
	 * @throws InvalidBaseTypeException if bases is neither a collection, an array nor a string
	 */
	public static PrimalityTestOptions fromMap(Map<String, ?> map) {
		Builder builder = builder();
		Object numRoundsValue = map.get(NUM_ROUNDS);
		if (numRoundsValue != null) {
			try {
				builder.numRounds(BigIntResolver.resolve(numRoundsValue).intValueExact());
			} catch (ArithmeticException ae) {
				throw new InputFormatException("numRounds = " + numRoundsValue + " is out of range", ae);
			}
		}
		Object basesValue = map.get(BASES);
		if (basesValue != null) {
			builder.bases(toList(basesValue));
		}
		Object findDivisorValue = map.get(FIND_DIVISOR);
		if (findDivisorValue != null) {
			builder.findDivisor(toBoolean(findDivisorValue));
		}
		return builder.build();
	}

	private static List<Object> toList(Object basesValue) {
		List<Object> list = new ArrayList<>();
		if (basesValue instanceof Collection) {
			list.addAll((Collection<?>) basesValue);
		} else if (basesValue.getClass().isArray()) {
			int length = Array.getLength(basesValue);
			for (int i = 0; i < length; i++) {
				list.add(Array.get(basesValue, i));
			}
		} else if (basesValue instanceof CharSequence) {
			for (String token : basesValue.toString().split("[,\\s]+")) {
				if (!token.isEmpty()) list.add(token);
			}
		} else {
			throw new InvalidBaseTypeException(basesValue);
		}
		return list;
	}

	private static boolean toBoolean(Object value) {
		if (value instanceof Boolean) return (Boolean) value;
		String str = value.toString().trim();
		if (str.equalsIgnoreCase("true")) return true;
		if (str.equalsIgnoreCase("false")) return false;
		throw new InputFormatException("findDivisor = " + value + " is not a boolean");
	}

	@Override
	public String toString() {
		return "PrimalityTestOptions(numRounds=" + numRounds + ", bases=" + bases + ", findDivisor=" + findDivisor + ")";
	}

	public static class Builder {
		private Integer numRounds = null;
		private List<BigInteger> bases = null;
		private boolean findDivisor = true;

		private Builder() {
			// use PrimalityTestOptions.builder()
		}

		/**
		 * @param numRounds number of random bases to test; values < 1 request the adaptive choice
		 * @return this
		 */
		public Builder numRounds(int numRounds) {
			this.numRounds = numRounds;
			return this;
		}

		/**
		 * Set explicit bases. Every element must be resolvable to an integer.
		 * @param bases
		 * @return this
		 * @throws InputFormatException if some base is not an integer
		 */
		public Builder bases(Collection<?> bases) {
			List<BigInteger> resolved = new ArrayList<>(bases.size());
			for (Object base : bases) {
				resolved.add(BigIntResolver.resolve(base));
			}
			this.bases = resolved;
			return this;
		}

		public Builder bases(Object... bases) {
			List<Object> list = new ArrayList<>(bases.length);
			Collections.addAll(list, bases);
			return bases(list);
		}

		public Builder findDivisor(boolean findDivisor) {
			this.findDivisor = findDivisor;
			return this;
		}

		public PrimalityTestOptions build() {
			return new PrimalityTestOptions(this);
		}
	}
}
