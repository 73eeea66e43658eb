package com.elssolution.insteonbridge.gateway;

import com.fazecast.jSerialComm.SerialPort;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;

/** Cheap checks run before the driver gets the port. */
@Slf4j
public final class SerialPortProbe {

    private SerialPortProbe() {}

    /** The /dev node exists and is readable. Non-path names (Windows COMx) are assumed present. */
    public static boolean devicePresent(String port) {
        if (port == null || !port.startsWith("/")) return true;
        try {
            Path p = Path.of(port).toRealPath();
            return Files.isReadable(p);
        } catch (Exception e) {
            return false;
        }
    }

    /** Opens and immediately closes the port, so a busy or dead adapter fails fast. */
    public static boolean canOpen(String port) {
        SerialPort serialPort;
        try {
            serialPort = SerialPort.getCommPort(port);
        } catch (RuntimeException e) {
            log.debug("serial_probe_lookup_failed port={}: {}", port, e.toString());
            return false;
        }
        if (!serialPort.openPort()) {
            log.warn("serial_probe_open_failed port={}", port);
            return false;
        }
        if (!serialPort.closePort()) {
            log.debug("serial_probe_close_failed port={}", port);
        }
        return true;
    }
}
