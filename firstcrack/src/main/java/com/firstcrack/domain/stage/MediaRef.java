package com.firstcrack.domain.stage;

/**
 * Image and/or video locator for a stage, relative to the media base URL
 * unless already absolute.
 */
public record MediaRef(String imagePath, String videoPath) {

    public static final MediaRef NONE = new MediaRef(null, null);

    public static MediaRef image(String imagePath) {
        return new MediaRef(imagePath, null);
    }

    public static MediaRef imageAndVideo(String imagePath, String videoPath) {
        return new MediaRef(imagePath, videoPath);
    }

    public boolean hasImage() {
        return imagePath != null && !imagePath.isBlank();
    }

    public boolean hasVideo() {
        return videoPath != null && !videoPath.isBlank();
    }
}
