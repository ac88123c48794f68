package cfgnorm.util;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Class with utility methods...
 */
public class Utils {

	/**
	 * Joins the string representations of several objects passed via a list.
	 *
	 * @param strs passed list of objects
	 * @param separator separator between those representations
	 * @param <T> type of the passed objects
	 * @return joined string
	 */
	public static <T> String join(List<T> strs, String separator){
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < strs.size(); i++){
			if (i != 0){
				builder.append(separator);
			}
			builder.append(strs.get(i));
		}
		return builder.toString();
	}

	@SafeVarargs
	public static <T> ArrayList<T> makeArrayList(T... elements){
		ArrayList<T> ret = new ArrayList<>(elements.length);
		for (int i = 0; i < elements.length; i++){
			ret.add(elements[i]);
		}
		return ret;
	}

	@SafeVarargs
	public static <T> HashSet<T> makeHashSet(T... elements){
		HashSet<T> ret = new HashSet<>(elements.length);
		for (int i = 0; i < elements.length; i++){
			ret.add(elements[i]);
		}
		return ret;
	}

	/**
	 * Insertion ordered set of the passed elements
	 */
	@SafeVarargs
	public static <T> LinkedHashSet<T> makeLinkedHashSet(T... elements){
		LinkedHashSet<T> ret = new LinkedHashSet<>(elements.length);
		for (int i = 0; i < elements.length; i++){
			ret.add(elements[i]);
		}
		return ret;
	}

	/**
	 * Concatenation of the passed lists
	 */
	@SafeVarargs
	public static <T> List<T> concat(List<? extends T>... lists){
		List<T> ret = new ArrayList<>();
		for (List<? extends T> list : lists){
			ret.addAll(list);
		}
		return ret;
	}
}
