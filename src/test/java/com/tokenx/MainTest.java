package com.tokenx;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenx.controllers.Controller;
import io.javalin.Javalin;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @Test
    void createAppRegistersEveryControllerWithoutStarting() {
        List<Javalin> registeredOn = new ArrayList<>();
        Controller first = registeredOn::add;
        Controller second = registeredOn::add;

        Javalin app = Main.createApp(new ObjectMapper(), List.of(first, second));

        assertNotNull(app);
        assertEquals(List.of(app, app), registeredOn);
    }
}
