package org.cbug.analyzer.prepwork;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * What the analysis knows about C standard library functions: which ones allocate, release or never
 * return, which ones leave their pointer arguments alone, where the format string of the formatted I/O
 * functions is, and which header declares a function.
 */
public final class StandardLibrary {

    public static final String FREE = "free";
    public static final String REALLOC = "realloc";

    private static final Set<String> ALLOCATORS = Set.of("malloc", "calloc", REALLOC, "aligned_alloc", "strdup",
            "strndup");
    private static final Set<String> NO_RETURN = Set.of("exit", "abort", "_Exit", "quick_exit");

    /*
    functions that neither release nor retain the pointers they are given; the content pointed to may change
     */
    private static final Set<String> READ_ONLY = Set.of(
            "printf", "fprintf", "dprintf", "sprintf", "snprintf", "scanf", "fscanf", "sscanf",
            "vprintf", "vfprintf", "vsprintf", "vsnprintf", "puts", "fputs", "fgets", "fread", "fwrite", "fputc",
            "putc", "fgetc", "getc", "fflush", "feof", "ferror", "perror", "rewind", "fseek", "ftell",
            "strlen", "strnlen", "strcmp", "strncmp", "strcasecmp", "strchr", "strrchr", "strstr", "strspn",
            "strcspn", "strpbrk", "strcpy", "strncpy", "strcat", "strncat", "strtok", "memcpy", "memmove", "memset",
            "memcmp", "memchr", "atoi", "atol", "atoll", "atof", "strtol", "strtoul", "strtoll", "strtod",
            "qsort", "bsearch", "toupper", "tolower", "isdigit", "isalpha", "isspace", "isalnum", "isupper",
            "islower", "assert");

    public record FormatFunction(String name, int formatIndex, boolean scan) {
    }

    private static final Map<String, FormatFunction> FORMAT_FUNCTIONS = Map.of(
            "printf", new FormatFunction("printf", 0, false),
            "fprintf", new FormatFunction("fprintf", 1, false),
            "dprintf", new FormatFunction("dprintf", 1, false),
            "sprintf", new FormatFunction("sprintf", 1, false),
            "snprintf", new FormatFunction("snprintf", 2, false),
            "scanf", new FormatFunction("scanf", 0, true),
            "fscanf", new FormatFunction("fscanf", 1, true),
            "sscanf", new FormatFunction("sscanf", 1, true));

    private static final Map<String, String> HEADERS;

    static {
        Map<String, String> map = new HashMap<>();
        for (String s : new String[]{"printf", "fprintf", "dprintf", "sprintf", "snprintf", "scanf", "fscanf",
                "sscanf", "puts", "fputs", "fgets", "fopen", "fclose", "fread", "fwrite", "getchar", "putchar",
                "perror", "fflush", "fputc", "fgetc"}) {
            map.put(s, "stdio.h");
        }
        for (String s : new String[]{"malloc", "calloc", REALLOC, FREE, "exit", "abort", "atoi", "atol", "atof",
                "strtol", "strtod", "rand", "srand", "qsort", "abs", "getenv", "system"}) {
            map.put(s, "stdlib.h");
        }
        for (String s : new String[]{"memcpy", "memmove", "memset", "memcmp", "strlen", "strcpy", "strncpy",
                "strcat", "strncat", "strcmp", "strncmp", "strchr", "strrchr", "strstr", "strdup", "strtok"}) {
            map.put(s, "string.h");
        }
        HEADERS = Map.copyOf(map);
    }

    private StandardLibrary() {
    }

    public static boolean isAllocator(String function) {
        return ALLOCATORS.contains(function);
    }

    public static boolean isDeallocator(String function) {
        return FREE.equals(function);
    }

    public static boolean isNoReturn(String function) {
        return NO_RETURN.contains(function);
    }

    public static boolean isReadOnly(String function) {
        return READ_ONLY.contains(function);
    }

    /*
    true when the library function reads or writes through its argument at the given index; variadic arguments
    of the printf family are not counted, those of the scanf family are
     */
    public static boolean dereferencesArgument(String function, int index) {
        if ("strdup".equals(function) || "strndup".equals(function)) return index == 0;
        if (!READ_ONLY.contains(function) || "assert".equals(function)) return false;
        FormatFunction formatFunction = FORMAT_FUNCTIONS.get(function);
        return formatFunction == null || index <= formatFunction.formatIndex() || formatFunction.scan();
    }

    public static FormatFunction formatFunction(String function) {
        return FORMAT_FUNCTIONS.get(function);
    }

    // null when the function is not one whose header is checked
    public static String header(String function) {
        return HEADERS.get(function);
    }
}
