package com.tokenx.qr;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.BinaryBitmap;
import com.google.zxing.DecodeHintType;
import com.google.zxing.EncodeHintType;
import com.google.zxing.LuminanceSource;
import com.google.zxing.MultiFormatReader;
import com.google.zxing.NotFoundException;
import com.google.zxing.Result;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.common.HybridBinarizer;
import com.google.zxing.qrcode.QRCodeWriter;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;
import com.tokenx.ErrorKind;
import com.tokenx.VaultException;
import dev.samstevens.totp.util.Utils;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Renders text as a QR code PNG and reads text back out of an image.
 */
public class QrCodeService {
    public static final int DEFAULT_SIZE = 300;
    public static final String PNG_MIME_TYPE = "image/png";

    private final int size;

    public QrCodeService() {
        this(DEFAULT_SIZE);
    }

    public QrCodeService(int size) {
        if (size < 21) {
            throw new IllegalArgumentException("QR size too small: " + size);
        }
        this.size = size;
    }

    public byte[] encodePng(String text) throws VaultException {
        Map<EncodeHintType, Object> hints = new EnumMap<>(EncodeHintType.class);
        hints.put(EncodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name());
        hints.put(EncodeHintType.ERROR_CORRECTION, ErrorCorrectionLevel.M);
        hints.put(EncodeHintType.MARGIN, 2);
        try {
            BitMatrix matrix = new QRCodeWriter().encode(text, BarcodeFormat.QR_CODE, size, size, hints);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            MatrixToImageWriter.writeToStream(matrix, "PNG", out);
            return out.toByteArray();
        } catch (WriterException | IOException e) {
            throw new VaultException(ErrorKind.IO_FAILURE, "Failed to render QR code", e);
        }
    }

    public String toDataUri(byte[] png) {
        return Utils.getDataUriForImage(png, PNG_MIME_TYPE);
    }

    /**
     * Decodes the first QR code found in an image (PNG, JPEG, BMP or GIF).
     *
     * @throws VaultException NO_QR_CODE if the bytes are not an image or hold no QR code
     */
    public String decode(byte[] imageBytes) throws VaultException {
        BufferedImage image;
        try {
            image = imageBytes == null ? null : ImageIO.read(new ByteArrayInputStream(imageBytes));
        } catch (IOException e) {
            throw new VaultException(ErrorKind.NO_QR_CODE, "File is not a readable image", e);
        }
        if (image == null) {
            throw new VaultException(ErrorKind.NO_QR_CODE, "File is not a readable image");
        }

        Map<DecodeHintType, Object> hints = new EnumMap<>(DecodeHintType.class);
        hints.put(DecodeHintType.POSSIBLE_FORMATS, List.of(BarcodeFormat.QR_CODE));
        hints.put(DecodeHintType.TRY_HARDER, Boolean.TRUE);
        hints.put(DecodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name());

        LuminanceSource source = new BufferedImageLuminanceSource(image);
        try {
            Result result = new MultiFormatReader().decode(new BinaryBitmap(new HybridBinarizer(source)), hints);
            return result.getText();
        } catch (NotFoundException e) {
            throw new VaultException(ErrorKind.NO_QR_CODE, "No QR code detected in this image");
        }
    }
}
