package org.dxworks.adocframe.model;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

public class VideoMacro extends Macro {

    private static final Set<String> KNOWN_FORMATS = Set.of("mp4", "webm", "ogg", "avi", "mov");
    private static final String DEFAULT_FORMAT = "mp4";

    private final String source;
    private final String title;
    private final Integer width;
    private final Integer height;
    private final String poster;
    private final boolean autoPlay;
    private final boolean controls;
    private final boolean loop;
    private final boolean muted;
    private final String videoFormat;

    public VideoMacro(String target, Map<String, String> parameters, MacroType macroType) {
        super("video", target, parameters, macroType);
        this.source = getTarget();
        this.title = parameter("title", "");
        this.width = intParameter("width");
        this.height = intParameter("height");
        this.poster = parameter("poster", "");
        this.autoPlay = booleanParameter("autoplay", false);
        this.controls = booleanParameter("controls", true);
        this.loop = booleanParameter("loop", false);
        this.muted = booleanParameter("muted", false);
        this.videoFormat = parameter("format", formatFromExtension(source));
    }

    private static String formatFromExtension(String path) {
        String extension = fileExtension(path).toLowerCase(Locale.ROOT);
        return KNOWN_FORMATS.contains(extension) ? extension : DEFAULT_FORMAT;
    }

    public String getSource() {
        return source;
    }

    public String getTitle() {
        return title;
    }

    public Integer getWidth() {
        return width;
    }

    public Integer getHeight() {
        return height;
    }

    public String getPoster() {
        return poster;
    }

    public boolean isAutoPlay() {
        return autoPlay;
    }

    public boolean isControls() {
        return controls;
    }

    public boolean isLoop() {
        return loop;
    }

    public boolean isMuted() {
        return muted;
    }

    public String getVideoFormat() {
        return videoFormat;
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
