package com.consullo.atlas.loader;

import com.consullo.atlas.core.AssetDescriptor;
import com.consullo.atlas.core.AssetKind;
import com.consullo.atlas.core.AssetSource;
import com.consullo.atlas.core.IdAllocator;
import com.consullo.atlas.core.ImageBuffer;
import com.consullo.atlas.core.Single;
import com.consullo.atlas.core.Tileset;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.imageio.ImageIO;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovers and decodes the assets of one collection directory.
 *
 * <p>
 * Files are visited in sorted path order so identifiers are reproducible across runs. Paths are
 * recorded relative to the collection's parent directory, so they start with the collection
 * name. Singles and tilesets are decoded eagerly; a file that cannot be decoded aborts the load.
 * </p>
 *
 * @since 1.0
 */
public final class AssetLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(AssetLoader.class);

  private final LoaderPolicy policy;
  private final IdAllocator ids;

  public AssetLoader(LoaderPolicy policy, IdAllocator ids) {
    Validate.notNull(policy, "policy must not be null");
    Validate.notNull(ids, "ids must not be null");
    this.policy = policy;
    this.ids = ids;
  }

  /**
   * Loads a collection.
   *
   * @param collectionRoot collection directory
   * @return loaded assets
   * @throws IOException if the directory cannot be walked
   * @throws MalformedImageException if a single or tileset cannot be decoded
   */
  public AssetCollection load(Path collectionRoot) throws IOException, MalformedImageException {
    Validate.notNull(collectionRoot, "collectionRoot must not be null");
    Path root = collectionRoot.toAbsolutePath().normalize();
    if (!Files.isDirectory(root)) {
      throw new NotDirectoryException(root.toString());
    }
    Path base = root.getParent() != null ? root.getParent() : root;

    List<Path> files;
    try (Stream<Path> walk = Files.walk(root)) {
      files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
    }

    List<Single> singles = new ArrayList<>();
    List<Tileset> tilesets = new ArrayList<>();
    List<AssetDescriptor> others = new ArrayList<>();

    for (Path file : files) {
      String relative = base.relativize(file).toString().replace(File.separatorChar, '/');
      Optional<AssetKind> kind = policy.classify(relative);
      if (kind.isEmpty()) {
        LOGGER.trace("load: skipping {}", relative);
        continue;
      }
      AssetSource source = new AssetSource(relative, TagParser.parse(relative, kind.get()));
      switch (kind.get()) {
        case SINGLE:
          singles.add(new Single(ids.next(), source, decode(file)));
          break;
        case TILESET:
          tilesets.add(new Tileset(ids.next(), source, decode(file)));
          break;
        default:
          others.add(new AssetDescriptor(ids.next(), kind.get(), source));
          break;
      }
    }

    String name = root.getFileName() != null ? root.getFileName().toString() : root.toString();
    LOGGER.info("Loaded {} singles and {} tilesets from {}.", singles.size(), tilesets.size(), name);
    return new AssetCollection(name, singles, tilesets, others);
  }

  /**
   * Decodes an image file into a pixel buffer.
   *
   * @param file image file
   * @return buffer
   * @throws MalformedImageException if no decoder accepts the file or it has no pixels
   */
  public static ImageBuffer decode(Path file) throws MalformedImageException {
    BufferedImage image;
    try {
      image = ImageIO.read(file.toFile());
    } catch (IOException e) {
      throw new MalformedImageException(file, "cannot be decoded", e);
    }
    if (image == null) {
      throw new MalformedImageException(file, "no decoder accepts this file", null);
    }
    if (image.getWidth() <= 0 || image.getHeight() <= 0) {
      throw new MalformedImageException(file, "image has no pixels", null);
    }
    return ImageBuffer.fromBufferedImage(image);
  }
}
