/*
 * Copyright (C) 2018 Jean Ollion
 * Copyright (C) 2026 Kymograph contributors
 *
 * This File is part of KYMOGRAPH
 *
 * KYMOGRAPH is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * KYMOGRAPH is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with KYMOGRAPH.  If not, see <http://www.gnu.org/licenses/>.
 */
package kymograph.utils;

import java.util.Arrays;
import java.util.Collection;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 *
 * @author Jean Ollion
 */
public class Utils {

    /**
     * @return integral values without decimal part, others with default double representation
     */
    public static String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value)<1e15) return Long.toString((long)value);
        return Double.toString(value);
    }

    public static <E extends Enum<E>> String[] toStringArray(E[] values) {
        return Arrays.stream(values).map(Enum::name).toArray(String[]::new);
    }

    public static <T> String toStringList(Collection<T> collection, Function<T, String> toString) {
        return collection.stream().map(toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
