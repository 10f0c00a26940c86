package org.dxworks.mesonactions.format;

import org.dxworks.mesonactions.support.MesonTestParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class SourcePrinterTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "x = [1, 'a\\'b', true]",
            "y = (a + b) * c",
            "z = a - (b - c)",
            "w = not (a and b)",
            "v = cond ? f(x, k: 1) : {'a': 2}['a']",
            "m = meson.get_compiler('c').get_id()",
            "s = f'@0@'",
            "n = -x + 0x1F",
            "t = 'x' not in list or y in list",
            "if a\n  b = 1\nelif c\n  d = 2\nelse\n  e = 3\nendif",
            "foreach k, v : d\n  message(k)\n  break\nendforeach",
            "x += ['a']"
    })
    void printsNormalizedSourceUnchanged(String source) {
        assertEquals(source, SourcePrinter.print(MesonTestParser.parse(source)));
    }

    @Test
    void normalizesLayout() {
        String source = "lib = static_library(\n    'foo',\n    'foo.c',\n    install : true,\n)";

        assertEquals("lib = static_library('foo', 'foo.c', install: true)",
                SourcePrinter.print(MesonTestParser.parse(source)));
    }

    @Test
    void quotesEscapes() {
        assertEquals("'a\\nb'", SourcePrinter.quote("a\nb"));
        assertEquals("'c:\\\\dir'", SourcePrinter.quote("c:\\dir"));
        assertEquals("'it\\'s'", SourcePrinter.quote("it's"));
    }
}
