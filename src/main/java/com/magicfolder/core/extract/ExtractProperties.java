package com.magicfolder.core.extract;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConfigurationProperties(prefix = "magicfolder.extract")
public class ExtractProperties {

    private List<String> textExtensions = List.of(
            "txt", "md", "csv", "json", "xml", "yaml", "yml", "log", "ini", "conf",
            "html", "htm", "py", "js", "ts", "java", "c", "cpp", "h", "sh", "sql", "env");
    private List<String> ocrExtensions = List.of(
            "pdf", "png", "jpg", "jpeg", "tif", "tiff", "bmp", "gif");
    private int maxTextChars = 50_000;

    public List<String> getTextExtensions() {
        return textExtensions;
    }

    public void setTextExtensions(List<String> textExtensions) {
        this.textExtensions = textExtensions;
    }

    public List<String> getOcrExtensions() {
        return ocrExtensions;
    }

    public void setOcrExtensions(List<String> ocrExtensions) {
        this.ocrExtensions = ocrExtensions;
    }

    public int getMaxTextChars() {
        return maxTextChars;
    }

    public void setMaxTextChars(int maxTextChars) {
        this.maxTextChars = maxTextChars;
    }
}
