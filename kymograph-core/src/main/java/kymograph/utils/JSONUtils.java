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

import org.json.simple.JSONArray;
import org.json.simple.JSONAware;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * @author Jean Ollion
 */
public class JSONUtils {
    public final static org.slf4j.Logger logger = LoggerFactory.getLogger(JSONUtils.class);

    public static Object toJSONEntry(Object o) {
        if (o==null) return null;
        else if (o instanceof JSONObject || o instanceof JSONArray) return o;
        else if (o instanceof JSONSerializable) return ((JSONSerializable)o).toJSONEntry();
        else if (o instanceof Number) return o;
        else if (o instanceof Boolean) return o;
        else if (o instanceof String) return o;
        else if (o instanceof List) {
            JSONArray l = new JSONArray();
            ((List)o).forEach((oo) -> l.add(toJSONEntry(oo)));
            return l;
        }
        else if (o instanceof Enum) return ((Enum)o).name();
        else return o.toString();
    }

    public static List<Long> fromLongArrayToList(List array) {
        List<Long> res = new ArrayList<>(array.size());
        for (Object o : array) res.add(((Number)o).longValue());
        return res;
    }
    public static String[] fromStringArray(List array) {
        String[] res = new String[array.size()];
        res = (String[])array.toArray(res);
        return res;
    }
    public static String serialize(JSONSerializable o) {
        Object entry = o.toJSONEntry();
        if (entry instanceof JSONAware) return ((JSONAware)entry).toJSONString();
        else return entry.toString();
    }
    public static JSONObject parse(String s) throws ParseException {
        Object res= new JSONParser().parse(s);
        return (JSONObject)res;
    }
}
