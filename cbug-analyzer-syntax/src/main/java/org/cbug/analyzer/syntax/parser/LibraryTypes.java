package org.cbug.analyzer.syntax.parser;

import org.cbug.analyzer.syntax.CType;

import java.util.HashMap;
import java.util.Map;

/*
types normally provided by the standard headers, which the front-end does not read
 */
final class LibraryTypes {
    static final CType FILE = CType.struct("struct FILE");

    static final Map<String, CType> TYPEDEFS = Map.ofEntries(
            Map.entry("size_t", CType.UNSIGNED_LONG),
            Map.entry("ssize_t", CType.LONG),
            Map.entry("ptrdiff_t", CType.LONG),
            Map.entry("intptr_t", CType.LONG),
            Map.entry("uintptr_t", CType.UNSIGNED_LONG),
            Map.entry("int8_t", CType.integral("signed char")),
            Map.entry("int16_t", CType.integral("short")),
            Map.entry("int32_t", CType.INT),
            Map.entry("int64_t", CType.LONG),
            Map.entry("uint8_t", CType.integral("unsigned char")),
            Map.entry("uint16_t", CType.integral("unsigned short")),
            Map.entry("uint32_t", CType.integral("unsigned int")),
            Map.entry("uint64_t", CType.UNSIGNED_LONG),
            Map.entry("bool", CType.integral("_Bool")),
            Map.entry("wchar_t", CType.INT),
            Map.entry("time_t", CType.LONG),
            Map.entry("clock_t", CType.LONG),
            Map.entry("pid_t", CType.INT),
            Map.entry("off_t", CType.LONG),
            Map.entry("FILE", FILE),
            Map.entry("va_list", CType.struct("va_list")));

    static final Map<String, CType> RETURN_TYPES;

    static {
        Map<String, CType> map = new HashMap<>();
        for (String s : new String[]{"malloc", "calloc", "realloc", "memcpy", "memmove", "memset", "memchr"}) {
            map.put(s, CType.VOID_POINTER);
        }
        for (String s : new String[]{"strdup", "strndup", "strcpy", "strncpy", "strcat", "strncat", "strchr", "strrchr",
                "strstr", "strtok", "fgets", "getenv", "gets"}) {
            map.put(s, CType.CHAR_POINTER);
        }
        for (String s : new String[]{"printf", "fprintf", "sprintf", "snprintf", "dprintf", "scanf", "fscanf", "sscanf",
                "puts", "putchar", "getchar", "fputs", "fputc", "fgetc", "getc", "putc", "atoi", "abs", "rand",
                "strcmp", "strncmp", "memcmp", "fclose", "fflush", "toupper", "tolower", "isdigit", "isalpha",
                "isspace", "isalnum", "isupper", "islower", "remove", "rename", "feof", "ferror"}) {
            map.put(s, CType.INT);
        }
        for (String s : new String[]{"atol", "labs", "strtol", "ftell", "time", "clock"}) {
            map.put(s, CType.LONG);
        }
        for (String s : new String[]{"strlen", "strtoul", "fread", "fwrite", "strspn", "strcspn"}) {
            map.put(s, CType.UNSIGNED_LONG);
        }
        for (String s : new String[]{"atof", "strtod", "sqrt", "pow", "fabs", "sin", "cos", "tan", "exp", "log",
                "log10", "floor", "ceil", "round", "fmod"}) {
            map.put(s, CType.DOUBLE);
        }
        for (String s : new String[]{"free", "exit", "abort", "_Exit", "quick_exit", "qsort", "srand", "perror",
                "rewind"}) {
            map.put(s, CType.VOID);
        }
        map.put("fopen", CType.pointerTo(FILE));
        map.put("fdopen", CType.pointerTo(FILE));
        RETURN_TYPES = Map.copyOf(map);
    }

    private LibraryTypes() {
    }
}
