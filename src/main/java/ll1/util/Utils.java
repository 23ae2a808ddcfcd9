package ll1.util;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Class with utility methods...
 */
public class Utils {

	/**
	 * Joins the string representations of the passed objects
	 *
	 * @param strs objects to join
	 * @param separator string between two objects
	 * @return joined string
	 */
	public static <T> String join(Collection<T> strs, String separator){
		StringBuilder builder = new StringBuilder();
		boolean first = true;
		for (T obj : strs){
			if (!first){
				builder.append(separator);
			}
			builder.append(obj);
			first = false;
		}
		return builder.toString();
	}

	/**
	 * Formats a set as "{ a, b, c }" with its elements sorted by their string representation.
	 */
	public static <T> String formatSet(Collection<T> set){
		List<String> strs = set.stream().map(Object::toString).sorted().collect(Collectors.toList());
		if (strs.isEmpty()){
			return "{}";
		}
		return "{ " + join(strs, ", ") + " }";
	}

	/**
	 * Pads the string with spaces on the right
	 */
	public static String padRight(String str, int width){
		StringBuilder builder = new StringBuilder(str);
		while (builder.length() < width){
			builder.append(' ');
		}
		return builder.toString();
	}
}
