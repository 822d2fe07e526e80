package org.janelia.fuzzer.detection;

/**
 * Everything a parameter grid needs to know about the image being fuzzed.
 */
public class ImageContext {

    private final ImageToProcess imageToProcess;
    private final SourceImage image;

    public ImageContext(final ImageToProcess imageToProcess,
                        final SourceImage image) {
        this.imageToProcess = imageToProcess;
        this.image = image;
    }

    public SourceImage getImage() {
        return image;
    }

    public String getFileName() {
        return imageToProcess.getFileName();
    }

    public RegionOfInterest getRegionOfInterest() {
        return imageToProcess.getRegionOfInterest();
    }
}
