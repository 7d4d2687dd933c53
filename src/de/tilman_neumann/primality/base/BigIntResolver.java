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
package de.tilman_neumann.primality.base;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Resolves the different input representations we accept to BigInteger.
 *
 * Accepted are BigInteger, the fixed-width integer types Byte, Short, Integer and Long,
 * BigDecimal, Float and Double with integral values, and CharSequences containing a decimal number
 * with optional sign or an unsigned hexadecimal (0x), octal (0o) or binary (0b) literal.
 *
 * @author Tilman Neumann
 */
public class BigIntResolver {

	private BigIntResolver() {
		// static methods only
	}

	/**
	 * Resolve the given object to a BigInteger.
	 * @param value
	 * @return the BigInteger value
	 * @throws InputFormatException if value has an unsupported type or is not an integer
	 */
	public static BigInteger resolve(Object value) {
		if (value == null) {
			throw new InputFormatException("can not resolve null to an integer");
		}
		if (value instanceof BigInteger) {
			return (BigInteger) value;
		}
		if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return BigInteger.valueOf(((Number) value).longValue());
		}
		if (value instanceof BigDecimal) {
			return toBigIntegerExact((BigDecimal) value, value);
		}
		if (value instanceof Double || value instanceof Float) {
			double d = ((Number) value).doubleValue();
			if (Double.isNaN(d) || Double.isInfinite(d)) {
				throw new InputFormatException(value + " is not an integer");
			}
			return toBigIntegerExact(new BigDecimal(d), value);
		}
		if (value instanceof CharSequence) {
			return parse(value.toString());
		}
		throw new InputFormatException("can not resolve type " + value.getClass().getName() + " to an integer: " + value);
	}

	/**
	 * Parse a String to a BigInteger.
	 * @param str decimal number with optional sign, or unsigned "0x", "0o", "0b" literal; surrounding whitespace is ignored
	 * @return the BigInteger value
	 * @throws InputFormatException if str is not an integer
	 */
	public static BigInteger parse(String str) {
		String input = str.trim();
		int radix = 10;
		String digits = input;
		if (input.length() > 2 && input.charAt(0) == '0') {
			switch (input.charAt(1)) {
			case 'x': case 'X': radix = 16; break;
			case 'o': case 'O': radix = 8; break;
			case 'b': case 'B': radix = 2; break;
			default: break;
			}
			if (radix != 10) {
				digits = input.substring(2);
				// a sign after the prefix is not permitted
				if (digits.charAt(0) == '-' || digits.charAt(0) == '+') {
					throw new InputFormatException("\"" + str + "\" is not an integer");
				}
			}
		}
		try {
			return new BigInteger(digits, radix);
		} catch (NumberFormatException nfe) {
			throw new InputFormatException("\"" + str + "\" is not an integer", nfe);
		}
	}

	private static BigInteger toBigIntegerExact(BigDecimal bd, Object original) {
		try {
			return bd.toBigIntegerExact();
		} catch (ArithmeticException ae) {
			throw new InputFormatException(original + " is not an integer", ae);
		}
	}
}
