package naytive.transform;

import naytive.build.BuildState;

import java.util.Map;

/**
 * C++ definitions injected once per run for string methods that std::string
 * does not offer.
 */
final class Helpers {
	static final String STR_TO_UPPER = "str_to_upper";
	static final String STR_TO_LOWER = "str_to_lower";
	static final String STR_REPLACE = "str_replace";
	static final String STR_SPLIT = "str_split";

	private static final Map<String, String> DEFINITIONS = Map.of(
			STR_TO_UPPER, """
					std::string str_to_upper(std::string str)
					{
					  for (size_t i = 0; i < str.size(); i++)
					  {
					    if (str[i] >= 'a' && str[i] <= 'z')
					    {
					      str[i] = str[i] - 32;
					    }
					  }
					  return str;
					}""",
			STR_TO_LOWER, """
					std::string str_to_lower(std::string str)
					{
					  for (size_t i = 0; i < str.size(); i++)
					  {
					    if (str[i] >= 'A' && str[i] <= 'Z')
					    {
					      str[i] = str[i] + 32;
					    }
					  }
					  return str;
					}""",
			STR_REPLACE, """
					std::string str_replace(std::string str, std::string from, std::string to)
					{
					  size_t start_pos = 0;
					  while ((start_pos = str.find(from, start_pos)) != std::string::npos)
					  {
					    str.replace(start_pos, from.length(), to);
					    start_pos += to.length();
					  }
					  return str;
					}""",
			STR_SPLIT, """
					std::vector<std::string> str_split(const std::string &str, const std::string &delimiter = " ")
					{
					  std::vector<std::string> result;
					  if (delimiter == " ")
					  {
					    std::istringstream iss(str);
					    std::string word;
					    while (iss >> word)
					    {
					      result.push_back(word);
					    }
					    return result;
					  }
					  if (delimiter.empty())
					  {
					    for (char c : str)
					    {
					      result.push_back(std::string(1, c));
					    }
					    return result;
					  }
					  size_t start = 0;
					  size_t end;
					  while ((end = str.find(delimiter, start)) != std::string::npos)
					  {
					    result.push_back(str.substr(start, end - start));
					    start = end + delimiter.length();
					  }
					  result.push_back(str.substr(start));
					  return result;
					}""");

	private Helpers() {
	}

	static String definition(String name) {
		String definition = DEFINITIONS.get(name);
		if (definition == null) {
			throw new IllegalArgumentException("Unknown helper " + name);
		}
		return definition;
	}

	static void require(BuildState state, String name) {
		state.addHelper(name, definition(name));
	}
}
