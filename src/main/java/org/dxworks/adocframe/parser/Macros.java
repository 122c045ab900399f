package org.dxworks.adocframe.parser;

import org.dxworks.adocframe.model.ImageMacro;
import org.dxworks.adocframe.model.IncludeMacro;
import org.dxworks.adocframe.model.Macro;
import org.dxworks.adocframe.model.MacroType;
import org.dxworks.adocframe.model.VideoMacro;

import java.util.Locale;
import java.util.Map;

final class Macros {

    private Macros() {
    }

    static Macro create(String name, String target, Map<String, String> parameters, MacroType macroType) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "image" -> new ImageMacro(target, parameters, macroType);
            case "video" -> new VideoMacro(target, parameters, macroType);
            case "include" -> new IncludeMacro(target, parameters, macroType);
            default -> new Macro(name, target, parameters, macroType);
        };
    }
}
