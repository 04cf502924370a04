package org.circulardrives.cdihealth.application.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class VendorResolverTest {

  @Test
  void brandWordInModelWins() {
    assertEquals(Optional.of("SAMSUNG"), VendorResolver.fromModel("Samsung SSD 970 EVO Plus 1TB"));
    assertEquals(Optional.of("WESTERN DIGITAL"), VendorResolver.fromModel("WDC WD40EFRX-68N32N0"));
    assertEquals(Optional.of("INTEL"), VendorResolver.fromModel("INTEL SSDSC2KB480G8"));
  }

  @Test
  void modelPrefixIdentifiesVendor() {
    assertEquals(Optional.of("SEAGATE"), VendorResolver.fromModel("ST4000NM0035-1V4107"));
    assertEquals(Optional.of("HGST"), VendorResolver.fromModel("HUS726040ALE610"));
    assertEquals(Optional.of("TOSHIBA"), VendorResolver.fromModel("MG04ACA400E"));
  }

  @Test
  void unknownModelResolvesToNothing() {
    assertTrue(VendorResolver.fromModel("QEMU HARDDISK").isEmpty());
    assertTrue(VendorResolver.fromModel("  ").isEmpty());
  }
}
