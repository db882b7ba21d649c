package fr.imt.distroforge.distroforge.business.utils;

import lombok.experimental.UtilityClass;

@UtilityClass
public class Constants {

    public static final String MANAGED_LABEL = "distroforge.managed";
    public static final String BUILD_LABEL = "distroforge.build-id";
    public static final String PURPOSE_LABEL = "distroforge.purpose";
    public static final String IMAGE_PREFIX = "distroforge";
    public static final String DOWNLOAD_PATH = "/api/build/download";

}
