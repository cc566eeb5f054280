package com.foo.ledger.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.openxml4j.opc.PackageAccess;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.util.IOUtils;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/**
 * Opens ledger workbooks read-only, after the checks POI itself does not make: the file is named
 * {@code .xlsx}, is within the size limit and starts with a zip local-file header.
 */
public final class WorkbookFiles {

  /** Largest single record POI may allocate while reading a package part. */
  private static final int MAX_RECORD_BYTES = 150_000_000;

  private static final byte[] ZIP_SIGNATURE = {0x50, 0x4B, 0x03, 0x04};

  static {
    IOUtils.setByteArrayMaxOverride(MAX_RECORD_BYTES);
  }

  private WorkbookFiles() {}

  /**
   * @return an open workbook; the caller closes it
   * @throws SecurityException when the name, size or signature check fails
   * @throws IOException when the file cannot be read or is not a spreadsheet package
   */
  public static Workbook open(Path file, int maxFileSizeMb) throws IOException {
    requireXlsxName(file);
    requireSizeWithin(file, maxFileSizeMb);
    requireZipSignature(file);

    OPCPackage pkg;
    try {
      pkg = OPCPackage.open(file.toFile(), PackageAccess.READ);
    } catch (InvalidFormatException | RuntimeException e) {
      throw new IOException("Failed to open XLSX package " + file.getFileName(), e);
    }
    try {
      return new XSSFWorkbook(pkg);
    } catch (IOException | RuntimeException e) {
      pkg.revert();
      throw new IOException("Failed to open XLSX workbook " + file.getFileName(), e);
    }
  }

  static void requireXlsxName(Path file) {
    String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
    if (!name.endsWith(".xlsx")) {
      throw new SecurityException("Only .xlsx ledgers are supported: " + file.getFileName());
    }
  }

  static void requireSizeWithin(Path file, int maxFileSizeMb) throws IOException {
    long size = Files.size(file);
    if (size > maxFileSizeMb * 1024L * 1024L) {
      throw new SecurityException(
          "%s is %d bytes, over the %d MB limit"
              .formatted(file.getFileName(), size, maxFileSizeMb));
    }
  }

  static void requireZipSignature(Path file) throws IOException {
    byte[] head;
    try (InputStream in = Files.newInputStream(file)) {
      head = in.readNBytes(ZIP_SIGNATURE.length);
    }
    if (head.length < ZIP_SIGNATURE.length) {
      throw new IOException("File is too small to be a workbook: " + file.getFileName());
    }
    if (!Arrays.equals(head, ZIP_SIGNATURE)) {
      throw new SecurityException(
          "%s is not an XLSX package; it may be corrupted or renamed"
              .formatted(file.getFileName()));
    }
  }
}
