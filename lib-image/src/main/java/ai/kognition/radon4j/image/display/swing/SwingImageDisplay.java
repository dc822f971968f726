/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.radon4j.image.display.swing;

import java.awt.BorderLayout;
import java.awt.Dimension;
import java.awt.Graphics;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.awt.image.BufferedImage;
import java.lang.reflect.InvocationTargetException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

import javax.swing.JFrame;
import javax.swing.JPanel;
import javax.swing.JScrollPane;
import javax.swing.SwingUtilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A scrollable Swing window showing a single image. Closing the window (or calling
 * {@link #close()}) releases anyone blocked in {@link #waitUntilClosed()}.
 */
public class SwingImageDisplay implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(SwingImageDisplay.class);

    private final AtomicReference<JFrame> frame = new AtomicReference<>(null);
    private final CountDownLatch closed = new CountDownLatch(1);

    private SwingImageDisplay() {}

    public static SwingImageDisplay showImage(final BufferedImage iioimage, final String title) throws InvocationTargetException,
        InterruptedException {
        final SwingImageDisplay ret = new SwingImageDisplay();
        SwingUtilities.invokeAndWait(() -> {
            final JFrame f = new JFrame(title);
            f.setContentPane(new ScrollImagePanel(iioimage));
            f.setSize(Math.min(iioimage.getWidth() + 20, 1200), Math.min(iioimage.getHeight() + 40, 1000));
            f.setDefaultCloseOperation(JFrame.DISPOSE_ON_CLOSE);
            f.addWindowListener(new WindowAdapter() {
                @Override
                public void windowClosed(final WindowEvent e) {
                    ret.closed.countDown();
                }
            });
            f.setVisible(true);
            ret.frame.set(f);
        });
        LOGGER.debug("Showing \"{}\" ({} X {})", title, iioimage.getWidth(), iioimage.getHeight());
        return ret;
    }

    public void waitUntilClosed() throws InterruptedException {
        closed.await();
    }

    @Override
    public void close() {
        final JFrame f = frame.getAndSet(null);
        if(f != null)
            SwingUtilities.invokeLater(f::dispose);
        closed.countDown();
    }

    public static class ScrollImagePanel extends JPanel {
        private static final long serialVersionUID = 1L;

        public ScrollImagePanel(final BufferedImage image) {
            final JPanel canvas = new JPanel() {
                private static final long serialVersionUID = 1L;

                @Override
                protected void paintComponent(final Graphics g) {
                    super.paintComponent(g);
                    g.drawImage(image, 0, 0, null);
                }
            };
            canvas.setPreferredSize(new Dimension(image.getWidth(), image.getHeight()));
            final JScrollPane sp = new JScrollPane(canvas);
            setLayout(new BorderLayout());
            add(sp, BorderLayout.CENTER);
        }
    }
}
