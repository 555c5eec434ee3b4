package com.scsslang.compiler.lexer;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * CSS 命名颜色表（名称 → 0xRRGGBB），另含 {@code transparent}
 */
public final class NamedColors {

    /** transparent 的特殊值，与任何 RGB 都不冲突 */
    public static final int TRANSPARENT = -1;

    private static final Map<String, Integer> BY_NAME;
    private static final Map<Integer, String> BY_RGB;

    static {
        Map<String, Integer> map = new HashMap<String, Integer>(256);
        put(map, "aliceblue", 0xf0f8ff);
        put(map, "antiquewhite", 0xfaebd7);
        put(map, "aqua", 0x00ffff);
        put(map, "aquamarine", 0x7fffd4);
        put(map, "azure", 0xf0ffff);
        put(map, "beige", 0xf5f5dc);
        put(map, "bisque", 0xffe4c4);
        put(map, "black", 0x000000);
        put(map, "blanchedalmond", 0xffebcd);
        put(map, "blue", 0x0000ff);
        put(map, "blueviolet", 0x8a2be2);
        put(map, "brown", 0xa52a2a);
        put(map, "burlywood", 0xdeb887);
        put(map, "cadetblue", 0x5f9ea0);
        put(map, "chartreuse", 0x7fff00);
        put(map, "chocolate", 0xd2691e);
        put(map, "coral", 0xff7f50);
        put(map, "cornflowerblue", 0x6495ed);
        put(map, "cornsilk", 0xfff8dc);
        put(map, "crimson", 0xdc143c);
        put(map, "cyan", 0x00ffff);
        put(map, "darkblue", 0x00008b);
        put(map, "darkcyan", 0x008b8b);
        put(map, "darkgoldenrod", 0xb8860b);
        put(map, "darkgray", 0xa9a9a9);
        put(map, "darkgreen", 0x006400);
        put(map, "darkgrey", 0xa9a9a9);
        put(map, "darkkhaki", 0xbdb76b);
        put(map, "darkmagenta", 0x8b008b);
        put(map, "darkolivegreen", 0x556b2f);
        put(map, "darkorange", 0xff8c00);
        put(map, "darkorchid", 0x9932cc);
        put(map, "darkred", 0x8b0000);
        put(map, "darksalmon", 0xe9967a);
        put(map, "darkseagreen", 0x8fbc8f);
        put(map, "darkslateblue", 0x483d8b);
        put(map, "darkslategray", 0x2f4f4f);
        put(map, "darkslategrey", 0x2f4f4f);
        put(map, "darkturquoise", 0x00ced1);
        put(map, "darkviolet", 0x9400d3);
        put(map, "deeppink", 0xff1493);
        put(map, "deepskyblue", 0x00bfff);
        put(map, "dimgray", 0x696969);
        put(map, "dimgrey", 0x696969);
        put(map, "dodgerblue", 0x1e90ff);
        put(map, "firebrick", 0xb22222);
        put(map, "floralwhite", 0xfffaf0);
        put(map, "forestgreen", 0x228b22);
        put(map, "fuchsia", 0xff00ff);
        put(map, "gainsboro", 0xdcdcdc);
        put(map, "ghostwhite", 0xf8f8ff);
        put(map, "gold", 0xffd700);
        put(map, "goldenrod", 0xdaa520);
        put(map, "gray", 0x808080);
        put(map, "green", 0x008000);
        put(map, "greenyellow", 0xadff2f);
        put(map, "grey", 0x808080);
        put(map, "honeydew", 0xf0fff0);
        put(map, "hotpink", 0xff69b4);
        put(map, "indianred", 0xcd5c5c);
        put(map, "indigo", 0x4b0082);
        put(map, "ivory", 0xfffff0);
        put(map, "khaki", 0xf0e68c);
        put(map, "lavender", 0xe6e6fa);
        put(map, "lavenderblush", 0xfff0f5);
        put(map, "lawngreen", 0x7cfc00);
        put(map, "lemonchiffon", 0xfffacd);
        put(map, "lightblue", 0xadd8e6);
        put(map, "lightcoral", 0xf08080);
        put(map, "lightcyan", 0xe0ffff);
        put(map, "lightgoldenrodyellow", 0xfafad2);
        put(map, "lightgray", 0xd3d3d3);
        put(map, "lightgreen", 0x90ee90);
        put(map, "lightgrey", 0xd3d3d3);
        put(map, "lightpink", 0xffb6c1);
        put(map, "lightsalmon", 0xffa07a);
        put(map, "lightseagreen", 0x20b2aa);
        put(map, "lightskyblue", 0x87cefa);
        put(map, "lightslategray", 0x778899);
        put(map, "lightslategrey", 0x778899);
        put(map, "lightsteelblue", 0xb0c4de);
        put(map, "lightyellow", 0xffffe0);
        put(map, "lime", 0x00ff00);
        put(map, "limegreen", 0x32cd32);
        put(map, "linen", 0xfaf0e6);
        put(map, "magenta", 0xff00ff);
        put(map, "maroon", 0x800000);
        put(map, "mediumaquamarine", 0x66cdaa);
        put(map, "mediumblue", 0x0000cd);
        put(map, "mediumorchid", 0xba55d3);
        put(map, "mediumpurple", 0x9370db);
        put(map, "mediumseagreen", 0x3cb371);
        put(map, "mediumslateblue", 0x7b68ee);
        put(map, "mediumspringgreen", 0x00fa9a);
        put(map, "mediumturquoise", 0x48d1cc);
        put(map, "mediumvioletred", 0xc71585);
        put(map, "midnightblue", 0x191970);
        put(map, "mintcream", 0xf5fffa);
        put(map, "mistyrose", 0xffe4e1);
        put(map, "moccasin", 0xffe4b5);
        put(map, "navajowhite", 0xffdead);
        put(map, "navy", 0x000080);
        put(map, "oldlace", 0xfdf5e6);
        put(map, "olive", 0x808000);
        put(map, "olivedrab", 0x6b8e23);
        put(map, "orange", 0xffa500);
        put(map, "orangered", 0xff4500);
        put(map, "orchid", 0xda70d6);
        put(map, "palegoldenrod", 0xeee8aa);
        put(map, "palegreen", 0x98fb98);
        put(map, "paleturquoise", 0xafeeee);
        put(map, "palevioletred", 0xdb7093);
        put(map, "papayawhip", 0xffefd5);
        put(map, "peachpuff", 0xffdab9);
        put(map, "peru", 0xcd853f);
        put(map, "pink", 0xffc0cb);
        put(map, "plum", 0xdda0dd);
        put(map, "powderblue", 0xb0e0e6);
        put(map, "purple", 0x800080);
        put(map, "rebeccapurple", 0x663399);
        put(map, "red", 0xff0000);
        put(map, "rosybrown", 0xbc8f8f);
        put(map, "royalblue", 0x4169e1);
        put(map, "saddlebrown", 0x8b4513);
        put(map, "salmon", 0xfa8072);
        put(map, "sandybrown", 0xf4a460);
        put(map, "seagreen", 0x2e8b57);
        put(map, "seashell", 0xfff5ee);
        put(map, "sienna", 0xa0522d);
        put(map, "silver", 0xc0c0c0);
        put(map, "skyblue", 0x87ceeb);
        put(map, "slateblue", 0x6a5acd);
        put(map, "slategray", 0x708090);
        put(map, "slategrey", 0x708090);
        put(map, "snow", 0xfffafa);
        put(map, "springgreen", 0x00ff7f);
        put(map, "steelblue", 0x4682b4);
        put(map, "tan", 0xd2b48c);
        put(map, "teal", 0x008080);
        put(map, "thistle", 0xd8bfd8);
        put(map, "tomato", 0xff6347);
        put(map, "turquoise", 0x40e0d0);
        put(map, "violet", 0xee82ee);
        put(map, "wheat", 0xf5deb3);
        put(map, "white", 0xffffff);
        put(map, "whitesmoke", 0xf5f5f5);
        put(map, "yellow", 0xffff00);
        put(map, "yellowgreen", 0x9acd32);
        BY_NAME = Collections.unmodifiableMap(map);

        Map<Integer, String> reverse = new HashMap<Integer, String>(256);
        for (Map.Entry<String, Integer> e : map.entrySet()) {
            String existing = reverse.get(e.getValue());
            // 同值多名时取最短者，等长取字典序小者（gray/grey 等）
            if (existing == null || e.getKey().length() < existing.length()
                    || (e.getKey().length() == existing.length() && e.getKey().compareTo(existing) < 0)) {
                reverse.put(e.getValue(), e.getKey());
            }
        }
        BY_RGB = Collections.unmodifiableMap(reverse);
    }

    private NamedColors() {}

    private static void put(Map<String, Integer> map, String name, int rgb) {
        map.put(name, rgb);
    }

    /** 按名称查找（不区分大小写），未找到返回 null */
    public static Integer lookup(String name) {
        return BY_NAME.get(name.toLowerCase(Locale.ROOT));
    }

    public static boolean isTransparent(String name) {
        return "transparent".equalsIgnoreCase(name);
    }

    /** 反查颜色名，未找到返回 null */
    public static String nameOf(int red, int green, int blue) {
        return BY_RGB.get((red << 16) | (green << 8) | blue);
    }
}
