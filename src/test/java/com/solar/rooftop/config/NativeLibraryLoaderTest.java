package com.solar.rooftop.config;

import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import static org.junit.jupiter.api.Assertions.*;

class NativeLibraryLoaderTest {

    @Test
    void repeatedLoadsAreHarmless() {
        NativeLibraryLoader.loadNativeLibraries();
        NativeLibraryLoader.loadNativeLibraries();

        assertTrue(NativeLibraryLoader.isLoaded());
        Mat mat = Mat.zeros(3, 3, CvType.CV_8UC1);
        try {
            assertEquals(9, mat.total());
        } finally {
            mat.release();
        }
    }
}
