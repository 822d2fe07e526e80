package org.janelia.fuzzer.client.opencv;

import org.bytedeco.javacpp.Loader;
import org.bytedeco.opencv.global.opencv_core;
import org.janelia.fuzzer.detection.DetectionRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the native OpenCV libraries and sets process wide OpenCL use.
 */
public class OpenCvRuntime
        implements DetectionRuntime {

    private final boolean useOpenCL;

    public OpenCvRuntime(final boolean useOpenCL) {
        this.useOpenCL = useOpenCL;
    }

    @Override
    public void initialize() {
        Loader.load(opencv_core.class);
        opencv_core.setUseOpenCL(useOpenCL);
        LOG.info("initialize: loaded OpenCV, haveOpenCL={}, useOpenCL={}",
                 opencv_core.haveOpenCL(), opencv_core.useOpenCL());
    }

    @Override
    public void close() {
        LOG.info("close: releasing OpenCV runtime");
        opencv_core.setUseOpenCL(false);
    }

    private static final Logger LOG = LoggerFactory.getLogger(OpenCvRuntime.class);
}
