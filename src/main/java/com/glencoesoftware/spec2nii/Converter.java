/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Command line tool for converting MRS files to NIfTI-MRS.
 */
public class Converter implements Callable<Integer> {

  private static final Logger LOGGER = LoggerFactory.getLogger(Converter.class);

  /** Extension of written images. */
  public static final String NIFTI_EXTENSION = ".nii";

  /** Extension of JSON sidecar files. */
  public static final String JSON_EXTENSION = ".json";

  private volatile InputFormat format;
  private volatile Path input;
  private volatile Path outputDirectory;
  private volatile String fileOut;
  private volatile Path affinePath;
  private volatile Double bandwidth;
  private volatile Double imagingFrequency;
  private volatile String nucleus;
  private volatile boolean writeJson = false;

  private volatile String logLevel = "WARN";
  private volatile boolean progressBars = false;
  private volatile boolean printVersion = false;
  private volatile boolean help = false;

  private IProgressListener progressListener;

  // Option setters

  /**
   * @param inputFormat format of the input file
   */
  @Parameters(
    index = "0",
    arity = "1",
    description = "input format; valid values: ${COMPLETION-CANDIDATES}",
    defaultValue = Option.NULL_VALUE
  )
  public void setFormat(InputFormat inputFormat) {
    format = inputFormat;
  }

  /**
   * @param inputPath file to convert
   */
  @Parameters(
    index = "1",
    arity = "1",
    description = "file to convert",
    defaultValue = Option.NULL_VALUE
  )
  public void setInput(String inputPath) {
    if (inputPath != null) {
      input = Paths.get(inputPath);
    }
    else {
      input = null;
    }
  }

  /**
   * @param directory directory in which output files are written
   */
  @Option(
    names = {"-o", "--outdir"},
    description = "Output directory (default: current directory)",
    defaultValue = Option.NULL_VALUE
  )
  public void setOutputDirectory(String directory) {
    outputDirectory = directory == null ? null : Paths.get(directory);
  }

  /**
   * Set the output base name.  By default the input file name without
   * its extension is used.
   *
   * @param name output base name
   */
  @Option(
    names = {"-f", "--fileout"},
    description = "Output file base name (default: input file base name)",
    defaultValue = Option.NULL_VALUE
  )
  public void setFileOut(String name) {
    fileOut = name;
  }

  /**
   * @param affine file containing a 4x4 affine in DICOM patient space
   */
  @Option(
    names = {"-a", "--affine"},
    description = "Text file containing a 4x4 affine matrix",
    defaultValue = Option.NULL_VALUE
  )
  public void setAffinePath(String affine) {
    affinePath = affine == null ? null : Paths.get(affine);
  }

  /**
   * @param bw receiver bandwidth in Hz
   */
  @Option(
    names = {"-b", "--bandwidth"},
    description = "Receiver bandwidth (spectral width) in Hz",
    defaultValue = Option.NULL_VALUE
  )
  public void setBandwidth(Double bw) {
    if (bw == null || bw > 0) {
      bandwidth = bw;
    }
    else {
      LOGGER.warn("Ignoring invalid bandwidth: {}", bw);
    }
  }

  /**
   * @param frequency imaging (spectrometer) frequency in MHz
   */
  @Option(
    names = {"-i", "--imagingfreq"},
    description = "Imaging (central) frequency in MHz",
    defaultValue = Option.NULL_VALUE
  )
  public void setImagingFrequency(Double frequency) {
    if (frequency == null || frequency > 0) {
      imagingFrequency = frequency;
    }
    else {
      LOGGER.warn("Ignoring invalid imaging frequency: {}", frequency);
    }
  }

  /**
   * @param nucleusName resonant nucleus, e.g. "1H" or "31P"
   */
  @Option(
    names = {"-n", "--nucleus"},
    description = "Resonant nucleus (default: ${DEFAULT-VALUE})",
    defaultValue = "1H"
  )
  public void setNucleus(String nucleusName) {
    nucleus = nucleusName;
  }

  /**
   * @param json true if a JSON sidecar should be written for each image
   */
  @Option(
    names = {"-j", "--json"},
    description = "Also write the header extension to a JSON sidecar",
    defaultValue = "false"
  )
  public void setWriteJson(boolean json) {
    writeJson = json;
  }

  /**
   * Set the slf4j logging level. Defaults to "WARN".
   *
   * @param level logging level
   */
  @Option(
    names = {"--log-level", "--debug"},
    arity = "0..1",
    description = "Change logging level; valid values are " +
      "OFF, ERROR, WARN, INFO, DEBUG, TRACE and ALL. " +
      "(default: ${DEFAULT-VALUE})",
    defaultValue = "WARN",
    fallbackValue = "DEBUG"
  )
  public void setLogLevel(String level) {
    if (level != null) {
      logLevel = level;
    }
  }

  /**
   * Configure whether or not a progress bar is shown while writing.
   *
   * @param useProgressBars whether or not to show progress bars
   */
  @Option(
    names = {"-p", "--progress"},
    description = "Print a progress bar while writing",
    defaultValue = "false"
  )
  public void setProgressBars(boolean useProgressBars) {
    progressBars = useProgressBars;
  }

  /**
   * @param versionOnly whether or not to print version information and exit
   */
  @Option(
    names = "--version",
    description = "Print version information and exit",
    help = true,
    defaultValue = "false"
  )
  public void setPrintVersionOnly(boolean versionOnly) {
    printVersion = versionOnly;
  }

  /**
   * @param helpOnly whether or not to print help and exit
   */
  @Option(
    names = {"-h", "--help"},
    description = "Print usage information and exit",
    usageHelp = true,
    defaultValue = "false"
  )
  public void setHelp(boolean helpOnly) {
    help = helpOnly;
  }

  // Option getters

  /**
   * @return input format
   */
  public InputFormat getFormat() {
    return format;
  }

  /**
   * @return file to convert
   */
  public Path getInput() {
    return input;
  }

  /**
   * @return output directory, defaulting to the current directory
   */
  public Path getOutputDirectory() {
    return outputDirectory == null ? Paths.get(".") : outputDirectory;
  }

  /**
   * @return explicit output base name, or null
   */
  public String getFileOut() {
    return fileOut;
  }

  /**
   * @return receiver bandwidth in Hz, or null
   */
  public Double getBandwidth() {
    return bandwidth;
  }

  /**
   * @return imaging frequency in MHz, or null
   */
  public Double getImagingFrequency() {
    return imagingFrequency;
  }

  /**
   * @return resonant nucleus
   */
  public String getNucleus() {
    return nucleus;
  }

  /**
   * @return true if JSON sidecars are written
   */
  public boolean getWriteJson() {
    return writeJson;
  }

  /**
   * @return logging level
   */
  public String getLogLevel() {
    return logLevel;
  }

  /**
   * The output base name: the value of --fileout if set, otherwise the
   * input file name without its extension.
   *
   * @return output base name
   */
  public String getBaseName() {
    if (fileOut != null) {
      return fileOut;
    }
    String name = input.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  /**
   * Read the affine given with --affine: 16 whitespace separated values
   * in row-major order.
   *
   * @return affine as read from the file, or null if none was given
   * @throws IOException if the file cannot be read
   * @throws MalformedInputException if the file does not hold 16 numbers
   */
  public AffineTransform readAffine() throws IOException {
    if (affinePath == null) {
      return null;
    }
    String text = new String(Files.readAllBytes(affinePath),
      StandardCharsets.UTF_8).trim();
    String[] tokens = text.isEmpty() ? new String[0] : text.split("\\s+");
    if (tokens.length != 16) {
      throw new MalformedInputException("affine", String.format(
        "Expected 16 values in %s, found %d", affinePath, tokens.length));
    }
    double[] values = new double[16];
    for (int i=0; i<values.length; i++) {
      try {
        values[i] = Double.parseDouble(tokens[i]);
      }
      catch (NumberFormatException e) {
        throw new MalformedInputException("affine",
          "Not a number: " + tokens[i], e);
      }
    }
    return AffineTransform.fromRowMajor(values);
  }

  // Conversion methods

  /**
   * @return 0 if conversion completed without error,
   *         -1 if conversion was not performed
   * @throws Exception on most conversion errors
   */
  @Override
  public Integer call() throws Exception {
    ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
        LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    root.setLevel(Level.toLevel(logLevel));

    if (help) {
      return -1;
    }

    if (printVersion) {
      System.out.println("Version = " + HeaderExtension.getToolVersion());
      System.out.println("NIfTI-MRS intent = " + NiftiMrsWriter.INTENT_NAME);
      return -1;
    }

    if (format == null) {
      throw new IllegalArgumentException("Input format not specified");
    }
    if (input == null) {
      throw new IllegalArgumentException("Input path not specified");
    }
    if (!Files.isRegularFile(input)) {
      throw new IllegalArgumentException("Input file not found: " + input);
    }

    if (progressBars) {
      setProgressListener(new ProgressBarListener(logLevel));
    }

    Slf4JStopWatch t0 = stopWatch();
    List<OutputContainer> containers;
    try {
      containers = format.convert(this);
    }
    catch (ConversionException e) {
      e.attachSource(input.getFileName().toString());
      LOGGER.error("Could not convert {}: {}", input, e.getMessage());
      throw e;
    }
    write(containers);
    t0.stop("convert");
    return 0;
  }

  /**
   * Write every container, and optionally its JSON sidecar, to the
   * output directory.
   *
   * @param containers containers to write
   * @return paths of the written images
   * @throws IOException if any file cannot be written
   */
  public List<Path> write(List<OutputContainer> containers)
    throws IOException
  {
    Path outdir = getOutputDirectory();
    Files.createDirectories(outdir);
    List<Path> written = new ArrayList<Path>();

    getProgressListener().notifyStart(containers.size());
    for (int i=0; i<containers.size(); i++) {
      OutputContainer container = containers.get(i);
      String name = container.getName();
      getProgressListener().notifyContainerStart(i, name);

      Path image = outdir.resolve(name + NIFTI_EXTENSION);
      NiftiMrsWriter.write(container, image);
      written.add(image);
      if (writeJson) {
        Path sidecar = outdir.resolve(name + JSON_EXTENSION);
        Files.write(sidecar, container.getHeader().toPrettyJson()
          .getBytes(StandardCharsets.UTF_8));
        LOGGER.info("Wrote {}", sidecar);
      }

      getProgressListener().notifyContainerEnd(i, name);
    }
    getProgressListener().notifyEnd();
    return written;
  }

  private static Slf4JStopWatch stopWatch() {
    return new Slf4JStopWatch(LOGGER, Slf4JStopWatch.DEBUG_LEVEL);
  }

  /**
   * Set a listener for container writing events.
   * Intended to be used to show a status bar.
   *
   * @param listener a progress event listener
   */
  public void setProgressListener(IProgressListener listener) {
    progressListener = listener;
  }

  /**
   * Get the current listener for container writing events.
   * If no listener was set, a no-op listener is returned.
   *
   * @return the current progress listener
   */
  public IProgressListener getProgressListener() {
    if (progressListener == null) {
      setProgressListener(new NoOpProgressListener());
    }
    return progressListener;
  }

  /**
   * Perform file conversion as specified by command line arguments.
   * @param args command line arguments
   */
  public static void main(String[] args) {
    int exitCode = new CommandLine(new Converter()).execute(args);
    System.exit(exitCode);
  }

}
