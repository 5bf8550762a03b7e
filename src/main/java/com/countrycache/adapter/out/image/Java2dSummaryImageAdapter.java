package com.countrycache.adapter.out.image;

import com.countrycache.application.port.out.SummaryImageRenderer;
import com.countrycache.domain.model.Country;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Renders the cache summary as a PNG with Java2D and keeps it at a fixed path.
 * Drawing and file I/O run on a worker thread.
 */
@Slf4j
public class Java2dSummaryImageAdapter implements SummaryImageRenderer {

    static final int WIDTH = 1000;
    static final int HEIGHT = 800;

    private static final BigDecimal BILLION = new BigDecimal("1000000000");
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'");

    private final Vertx vertx;
    private final FlagImageLoader flagLoader;
    private final Path imagePath;
    private final int topCount;

    public Java2dSummaryImageAdapter(Vertx vertx, FlagImageLoader flagLoader, Path imagePath, int topCount) {
        this.vertx = vertx;
        this.flagLoader = flagLoader;
        this.imagePath = imagePath;
        this.topCount = topCount;
    }

    @Override
    public Future<Void> render(List<Country> countries, LocalDateTime refreshedAt) {
        List<Country> top = topByGdp(countries);
        log.debug("Rendering summary for {} countries, top {} by GDP", countries.size(), top.size());

        return flagLoader.loadAll(top.stream().map(Country::getFlagUrl).collect(Collectors.toList()))
                .compose(flags -> vertx.<Void>executeBlocking(() -> {
                    BufferedImage image = draw(countries, top, flags, refreshedAt);
                    write(image);
                    return null;
                }))
                .onSuccess(v -> log.info("Summary image saved to {}", imagePath));
    }

    @Override
    public Future<Optional<Buffer>> readCurrent() {
        String path = imagePath.toString();
        return vertx.fileSystem().exists(path)
                .compose(exists -> {
                    if (!exists) {
                        return Future.succeededFuture(Optional.<Buffer>empty());
                    }
                    return vertx.fileSystem().readFile(path).map(Optional::of);
                });
    }

    private List<Country> topByGdp(List<Country> countries) {
        return countries.stream()
                .filter(country -> country.getEstimatedGdp() != null)
                .sorted(Comparator.comparing(Country::getEstimatedGdp).reversed())
                .limit(topCount)
                .collect(Collectors.toList());
    }

    BufferedImage draw(List<Country> countries, List<Country> top, List<byte[]> flags, LocalDateTime refreshedAt) {
        BufferedImage image = new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, WIDTH, HEIGHT);

            g.setColor(Color.BLACK);
            g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 36));
            g.drawString("Country Data Summary", 50, 70);

            g.setColor(new Color(50, 50, 50));
            g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 22));
            g.drawString("Total Countries Cached: " + countries.size(), 50, 130);
            if (refreshedAt != null) {
                g.drawString("Last Refreshed: " + refreshedAt.format(TIMESTAMP_FORMAT), 50, 165);
            }
            drawAggregates(g, countries);

            g.setColor(Color.BLACK);
            g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 28));
            g.drawString("Top " + top.size() + " Countries by Estimated GDP:", 50, 310);

            g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 22));
            int y = 340;
            for (int i = 0; i < top.size(); i++) {
                Country country = top.get(i);
                drawFlag(g, i < flags.size() ? flags.get(i) : null, 60, y);
                g.setColor(new Color(20, 20, 20));
                g.drawString(String.format(Locale.ROOT, "%d. %s - GDP: $%s Billion",
                        i + 1, country.getName(), billions(country.getEstimatedGdp())), 140, y + 28);
                y += 80;
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    private void drawAggregates(Graphics2D g, List<Country> countries) {
        List<Country> withGdp = countries.stream()
                .filter(country -> country.getEstimatedGdp() != null)
                .collect(Collectors.toList());
        if (withGdp.isEmpty()) {
            g.drawString("No GDP estimates available", 50, 200);
            return;
        }

        BigDecimal total = withGdp.stream().map(Country::getEstimatedGdp).reduce(BigDecimal.ZERO, BigDecimal::add);
        Country highest = withGdp.stream().max(Comparator.comparing(Country::getEstimatedGdp)).orElseThrow();
        Country lowest = withGdp.stream().min(Comparator.comparing(Country::getEstimatedGdp)).orElseThrow();

        g.drawString("Total Estimated GDP: $" + billions(total) + " Billion", 50, 200);
        g.drawString("Highest: " + highest.getName() + " ($" + billions(highest.getEstimatedGdp()) + " Billion)", 50, 235);
        g.drawString("Lowest: " + lowest.getName() + " ($" + billions(lowest.getEstimatedGdp()) + " Billion)", 50, 270);
    }

    private void drawFlag(Graphics2D g, byte[] flagBytes, int x, int y) {
        BufferedImage flag = decode(flagBytes);
        if (flag != null) {
            g.drawImage(flag, x, y, 60, 40, null);
            return;
        }
        // Placeholder frame for missing flags
        g.setColor(Color.LIGHT_GRAY);
        g.setStroke(new BasicStroke(1));
        g.drawRect(x, y, 60, 40);
    }

    private BufferedImage decode(byte[] flagBytes) {
        if (flagBytes == null) {
            return null;
        }
        try {
            // null for formats ImageIO cannot read, e.g. SVG
            return ImageIO.read(new ByteArrayInputStream(flagBytes));
        } catch (IOException e) {
            log.warn("Could not decode flag image: {}", e.getMessage());
            return null;
        }
    }

    private void write(BufferedImage image) throws IOException {
        Path directory = Objects.requireNonNullElse(imagePath.toAbsolutePath().getParent(), Path.of("."));
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, "summary", ".png.tmp");
        try {
            ImageIO.write(image, "png", temp.toFile());
            Files.move(temp, imagePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static String billions(BigDecimal gdp) {
        return String.format(Locale.ROOT, "%,.2f", gdp.divide(BILLION, 2, RoundingMode.HALF_UP));
    }
}
