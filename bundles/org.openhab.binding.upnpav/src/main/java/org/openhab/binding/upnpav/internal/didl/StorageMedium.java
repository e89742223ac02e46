/**
 * Copyright (c) 2010-2024 Contributors to the openHAB project
 *
 * See the NOTICE file(s) distributed with this work for additional
 * information.
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which is available at
 * http://www.eclipse.org/legal/epl-2.0
 *
 * SPDX-License-Identifier: EPL-2.0
 */
package org.openhab.binding.upnpav.internal.didl;

import org.eclipse.jdt.annotation.NonNullByDefault;

/**
 * The {@code upnp:storageMedium} vocabulary. Devices may send values outside it, so the field stays a string.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public final class StorageMedium {

    public static final String UNKNOWN = "UNKNOWN";
    public static final String DV = "DV";
    public static final String MINI_DV = "MINI-DV";
    public static final String VHS = "VHS";
    public static final String W_VHS = "W-VHS";
    public static final String S_VHS = "S-VHS";
    public static final String D_VHS = "D-VHS";
    public static final String VHSC = "VHSC";
    public static final String VIDEO8 = "VIDEO8";
    public static final String HI8 = "HI8";
    public static final String CD_ROM = "CD-ROM";
    public static final String CD_DA = "CD-DA";
    public static final String CD_R = "CD-R";
    public static final String CD_RW = "CD-RW";
    public static final String VIDEO_CD = "VIDEO-CD";
    public static final String SACD = "SACD";
    public static final String MD_AUDIO = "MD-AUDIO";
    public static final String MD_PICTURE = "MD-PICTURE";
    public static final String DVD_ROM = "DVD-ROM";
    public static final String DVD_VIDEO = "DVD-VIDEO";
    public static final String DVD_R = "DVD-R";
    public static final String DVD_PLUS_RW = "DVD+RW";
    public static final String DVD_RW = "DVD-RW";
    public static final String DVD_RAM = "DVD-RAM";
    public static final String DVD_AUDIO = "DVD-AUDIO";
    public static final String DAT = "DAT";
    public static final String LD = "LD";
    public static final String HDD = "HDD";

    private StorageMedium() {
    }
}
