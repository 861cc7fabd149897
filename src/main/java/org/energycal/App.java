package org.energycal;

import com.formdev.flatlaf.FlatLaf;
import com.formdev.flatlaf.themes.FlatMacDarkLaf;
import org.energycal.catalog.CatalogSource;
import org.energycal.catalog.ReferenceEnergy;
import org.energycal.catalog.SourceCatalog;
import org.energycal.fit.CalibrationPoint;
import org.energycal.fit.PolynomialModel;
import org.energycal.session.CalibrationSession;
import org.energycal.session.PointEntry;
import org.knowm.xchart.XChartPanel;
import org.knowm.xchart.XYChart;
import org.knowm.xchart.XYChartBuilder;
import org.knowm.xchart.XYSeries;
import org.knowm.xchart.style.lines.SeriesLines;
import org.knowm.xchart.style.markers.SeriesMarkers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.*;
import javax.swing.border.EmptyBorder;
import javax.swing.event.DocumentEvent;
import javax.swing.event.DocumentListener;
import javax.swing.table.DefaultTableModel;
import java.awt.*;
import java.awt.event.KeyAdapter;
import java.awt.event.KeyEvent;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

public class App {

    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private static final int CHANNEL_COL = 0, ENERGY_COL = 1, COMMENT_COL = 2;

    private final CalibratorSettings settings;
    private final CalibrationSession session;
    private final SourceCatalog catalog;

    private final JFrame frame = new JFrame("Energy Calibrator");
    private final JTextField degreeField = new JTextField(4);
    private final JButton deleteButton = new JButton("Delete Selected Row(s)");
    private final JButton exitButton = new JButton("Exit");
    private final JTextArea pasteArea = new JTextArea(3, 30);
    private final JButton addRowsButton = new JButton("Add from Paste");
    private final JLabel equationLabel = new JLabel(" ");
    private final JLabel chi2Label = new JLabel(" ");
    private final JLabel hintLabel = new JLabel("Paste channel and energy columns. Tabs, semicolons or spaces accepted.");
    private final ConversionBox forwardBox;
    private final ConversionBox reverseBox;
    private final DefaultListModel<CatalogSource> sourceListModel = new DefaultListModel<>();
    private final JList<CatalogSource> sourceList = new JList<>(sourceListModel);

    private final DefaultTableModel tableModel;
    private final JTable table;

    private XYChart chart;
    private XChartPanel<XYChart> chartPanel;

    App(CalibratorSettings settings, SourceCatalog catalog) {
        this.settings = settings;
        this.catalog = catalog;
        this.session = new CalibrationSession(settings.getChannelLabel(), settings.getEnergyLabel(),
                settings.getRealRootTolerance());
        this.tableModel = new DefaultTableModel(
                new Object[]{settings.getChannelLabel(), settings.getEnergyLabel(), "Comment"}, 0) {
            @Override public Class<?> getColumnClass(int columnIndex) { return String.class; }
        };
        this.table = new JTable(tableModel);
        this.forwardBox = new ConversionBox(settings.getChannelLabel() + " -> " + settings.getEnergyLabel(),
                session::forward);
        this.reverseBox = new ConversionBox(settings.getEnergyLabel() + " -> " + settings.getChannelLabel(),
                session::reverse);
    }

    public static void main(String[] args) {
        CalibratorSettings settings = CalibratorSettings.fromSystemProperties();
        SourceCatalog catalog = loadCatalog(settings);
        FlatLaf.setup(new FlatMacDarkLaf());
        SwingUtilities.invokeLater(() -> new App(settings, catalog).start());
    }

    private static SourceCatalog loadCatalog(CalibratorSettings settings) {
        if (!Files.isRegularFile(settings.getCatalogPath())) {
            LOGGER.info("No source catalog at {}", settings.getCatalogPath());
            return SourceCatalog.empty();
        }
        try {
            return SourceCatalog.load(settings.getCatalogPath());
        } catch (IOException ex) {
            LOGGER.warn("Could not read source catalog {}", settings.getCatalogPath(), ex);
            return SourceCatalog.empty();
        }
    }

    private void start() {
        frame.setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);
        frame.setMinimumSize(new Dimension(1200, 720));
        frame.setLayout(new BorderLayout());
        frame.add(buildTopBar(), BorderLayout.NORTH);
        frame.add(buildMainSplit(), BorderLayout.CENTER);
        frame.add(buildBottomBar(), BorderLayout.SOUTH);

        catalog.getSources().forEach(sourceListModel::addElement);
        degreeField.setText(settings.getInitialDegree());
        ensureBlankRow();

        degreeField.getDocument().addDocumentListener(onChange(this::refit));
        tableModel.addTableModelListener(e -> refit());
        addRowsButton.addActionListener(e -> addRowsFromPaste());
        deleteButton.addActionListener(e -> deleteSelectedRows());
        exitButton.addActionListener(e -> frame.dispose());
        sourceList.addListSelectionListener(e -> {
            if (e.getValueIsAdjusting()) return;
            CatalogSource source = sourceList.getSelectedValue();
            if (source != null) {
                addSource(source);
                sourceList.clearSelection();
            }
        });

        // Enable DEL key to delete selected rows
        table.addKeyListener(new KeyAdapter() {
            @Override public void keyPressed(KeyEvent e) {
                if (e.getKeyCode() == KeyEvent.VK_DELETE && !table.isEditing()) deleteSelectedRows();
            }
        });

        refit();
        frame.setLocationRelativeTo(null);
        frame.setVisible(true);
    }

    private JPanel buildTopBar() {
        JPanel top = new JPanel(new BorderLayout());
        top.setBorder(new EmptyBorder(10, 12, 10, 12));

        JPanel left = new JPanel();
        left.setOpaque(false);
        left.setLayout(new FlowLayout(FlowLayout.LEFT, 10, 0));
        left.add(new JLabel("Degree ="));
        left.add(degreeField);

        JPanel right = new JPanel();
        right.setOpaque(false);
        right.setLayout(new FlowLayout(FlowLayout.RIGHT, 10, 0));
        right.add(deleteButton);
        right.add(exitButton);

        top.add(left, BorderLayout.WEST);
        top.add(right, BorderLayout.EAST);
        return top;
    }

    private JSplitPane buildMainSplit() {
        JSplitPane split = new JSplitPane(JSplitPane.HORIZONTAL_SPLIT);
        split.setResizeWeight(0.36);
        split.setLeftComponent(buildLeftPanel());
        split.setRightComponent(buildRightPanel());
        return split;
    }

    private JPanel buildLeftPanel() {
        JPanel panel = new JPanel(new BorderLayout(0, 10));
        panel.setBorder(new EmptyBorder(10, 12, 10, 12));

        JPanel pastePanel = new JPanel(new BorderLayout(6, 6));
        pastePanel.setBorder(BorderFactory.createTitledBorder("Paste"));
        hintLabel.setForeground(new Color(180, 180, 180));
        pastePanel.add(hintLabel, BorderLayout.NORTH);
        pasteArea.setLineWrap(true);
        pasteArea.setWrapStyleWord(true);
        pastePanel.add(new JScrollPane(pasteArea), BorderLayout.CENTER);

        JPanel pasteButtons = new JPanel(new FlowLayout(FlowLayout.RIGHT, 10, 0));
        pasteButtons.add(addRowsButton);
        pastePanel.add(pasteButtons, BorderLayout.SOUTH);

        JPanel tablePanel = new JPanel(new BorderLayout());
        tablePanel.setBorder(BorderFactory.createTitledBorder("Points"));
        table.setSelectionMode(ListSelectionModel.MULTIPLE_INTERVAL_SELECTION);
        table.putClientProperty("terminateEditOnFocusLost", Boolean.TRUE);
        tablePanel.add(new JScrollPane(table), BorderLayout.CENTER);

        JPanel sourcePanel = new JPanel(new BorderLayout());
        sourcePanel.setBorder(BorderFactory.createTitledBorder("Add Source"));
        sourceList.setSelectionMode(ListSelectionModel.SINGLE_SELECTION);
        sourceList.setVisibleRowCount(6);
        sourcePanel.add(new JScrollPane(sourceList), BorderLayout.CENTER);

        panel.add(pastePanel, BorderLayout.NORTH);
        panel.add(tablePanel, BorderLayout.CENTER);
        panel.add(sourcePanel, BorderLayout.SOUTH);
        return panel;
    }

    private JPanel buildRightPanel() {
        JPanel fitPanel = new JPanel(new GridLayout(2, 1, 0, 4));
        fitPanel.setBorder(BorderFactory.createTitledBorder("Fit"));
        fitPanel.add(equationLabel);
        fitPanel.add(chi2Label);

        JPanel conversions = new JPanel(new GridLayout(1, 2, 10, 0));
        conversions.add(forwardBox.panel);
        conversions.add(reverseBox.panel);

        JPanel north = new JPanel(new BorderLayout(0, 10));
        north.add(fitPanel, BorderLayout.NORTH);
        north.add(conversions, BorderLayout.CENTER);

        JPanel right = new JPanel(new BorderLayout(0, 10));
        right.setBorder(new EmptyBorder(10, 12, 10, 12));
        right.add(north, BorderLayout.NORTH);
        right.add(buildChartPanel(), BorderLayout.CENTER);
        return right;
    }

    private JPanel buildChartPanel() {
        chart = new XYChartBuilder()
                .width(800).height(500)
                .title("Calibration")
                .xAxisTitle(settings.getChannelLabel()).yAxisTitle(settings.getEnergyLabel())
                .build();

        chart.getStyler().setChartBackgroundColor(new Color(27, 27, 27));
        chart.getStyler().setPlotBackgroundColor(new Color(32, 32, 32));
        chart.getStyler().setPlotGridLinesColor(new Color(70, 70, 70));
        chart.getStyler().setXAxisTickMarkSpacingHint(60);
        chart.getStyler().setLegendVisible(true);
        chart.getStyler().setLegendBackgroundColor(new Color(45, 45, 45));
        chart.getStyler().setLegendBorderColor(new Color(80, 80, 80));
        chart.getStyler().setChartFontColor(new Color(230, 230, 230));
        chart.getStyler().setAxisTickLabelsColor(new Color(220, 220, 220));
        chart.getStyler().setMarkerSize(6);

        chartPanel = new XChartPanel<>(chart);
        JPanel wrapper = new JPanel(new BorderLayout());
        wrapper.add(chartPanel, BorderLayout.CENTER);
        return wrapper;
    }

    private JPanel buildBottomBar() {
        JPanel bottom = new JPanel(new BorderLayout());
        bottom.setBorder(new EmptyBorder(8, 12, 12, 12));
        JLabel status = new JLabel(catalog.getSources().isEmpty()
                ? "No source catalog loaded."
                : catalog.getSources().size() + " calibration sources available.");
        bottom.add(status, BorderLayout.WEST);
        return bottom;
    }

    // === Points ===

    private List<PointEntry> readRows() {
        List<PointEntry> rows = new ArrayList<>();
        for (int i = 0; i < tableModel.getRowCount(); i++) {
            rows.add(new PointEntry(cell(i, CHANNEL_COL), cell(i, ENERGY_COL), cell(i, COMMENT_COL)));
        }
        return rows;
    }

    private String cell(int row, int col) {
        Object value = tableModel.getValueAt(row, col);
        return value == null ? "" : value.toString();
    }

    private boolean isBlank(int row) {
        return cell(row, CHANNEL_COL).isBlank() && cell(row, ENERGY_COL).isBlank() && cell(row, COMMENT_COL).isBlank();
    }

    /** Keeps exactly one empty row at the bottom for typing new points. */
    private void ensureBlankRow() {
        int n = tableModel.getRowCount();
        if (n == 0 || !isBlank(n - 1)) tableModel.addRow(new Object[]{"", "", ""});
    }

    private void addSource(CatalogSource source) {
        // Fill the trailing blank row first
        int last = tableModel.getRowCount() - 1;
        if (last >= 0 && isBlank(last)) tableModel.removeRow(last);
        for (ReferenceEnergy energy : source.getEnergies()) {
            tableModel.addRow(new Object[]{"", String.valueOf(energy.getValue()), energy.getDescription()});
        }
        ensureBlankRow();
    }

    private void addRowsFromPaste() {
        String text = pasteArea.getText().trim();
        if (text.isEmpty()) return;

        int last = tableModel.getRowCount() - 1;
        if (last >= 0 && isBlank(last)) tableModel.removeRow(last);

        int added = 0;
        for (String line : text.split("\\R")) {
            if (line.trim().isEmpty()) continue;
            String[] tokens = splitSmart(line.trim());
            if (tokens.length < 2) continue;
            String comment = tokens.length > 2 ? String.join(" ", Arrays.copyOfRange(tokens, 2, tokens.length)) : "";
            tableModel.addRow(new Object[]{tokens[0], tokens[1], comment});
            added++;
        }
        ensureBlankRow();

        if (added == 0) {
            JOptionPane.showMessageDialog(frame,
                    "Could not read any rows. Expecting channel and energy columns per line.",
                    "Paste Warning", JOptionPane.WARNING_MESSAGE);
        }
    }

    /**
     * Splits a pasted line: tab/semicolon first, then runs of spaces. Commas are left alone
     * since they may be decimal commas.
     */
    private static String[] splitSmart(String line) {
        String[] t = line.split("[\\t;]+");
        if (t.length >= 2) return trimAll(t);
        return trimAll(line.trim().split("\\s+"));
    }

    private static String[] trimAll(String[] arr) {
        String[] out = new String[arr.length];
        for (int i = 0; i < arr.length; i++) out[i] = arr[i].trim();
        return out;
    }

    private void deleteSelectedRows() {
        int[] selected = table.getSelectedRows();
        if (selected.length == 0) return;

        Arrays.sort(selected);
        for (int i = selected.length - 1; i >= 0; i--) {
            tableModel.removeRow(table.convertRowIndexToModel(selected[i]));
        }
        ensureBlankRow();
    }

    // === Fitting ===

    private void refit() {
        // Adding rows from inside a table event confuses JTable, so defer it
        SwingUtilities.invokeLater(this::ensureBlankRow);
        try {
            session.refit(readRows(), degreeField.getText());
            equationLabel.setText(session.equationText());
            chi2Label.setText(session.chi2Text());
            forwardBox.update();
            reverseBox.update();
            updateChart(session.getPoints(), session.currentModel());
        } catch (RuntimeException ex) {
            LOGGER.error("Refit failed", ex);
            JOptionPane.showMessageDialog(frame,
                    "An unexpected error occurred: " + ex.getMessage(),
                    "Fitting Error", JOptionPane.ERROR_MESSAGE);
        }
    }

    // === Chart update ===

    private void updateChart(List<CalibrationPoint> points, Optional<PolynomialModel> fit) {
        chart.getSeriesMap().clear();
        if (points.isEmpty()) {
            chartPanel.repaint();
            return;
        }

        double[] xs = points.stream().mapToDouble(CalibrationPoint::getX).toArray();
        double[] ys = points.stream().mapToDouble(CalibrationPoint::getY).toArray();
        XYSeries scatter = chart.addSeries("Points", xs, ys);
        scatter.setMarker(SeriesMarkers.CIRCLE);
        scatter.setLineStyle(SeriesLines.NONE);
        scatter.setMarkerColor(new Color(91, 207, 250));

        if (fit.isPresent()) {
            PolynomialModel model = fit.get();
            double min = Arrays.stream(xs).min().orElse(0), max = Arrays.stream(xs).max().orElse(1);
            if (min == max) { min -= 1; max += 1; }
            int samples = Math.min(1000, Math.max(200, xs.length * 10));
            double[] fx = new double[samples];
            double[] fy = new double[samples];
            double step = (max - min) / (samples - 1);
            for (int i = 0; i < samples; i++) {
                fx[i] = min + i * step;
                fy[i] = model.evaluate(fx[i]);
            }
            XYSeries fitSeries = chart.addSeries("Fit", fx, fy);
            fitSeries.setMarker(SeriesMarkers.NONE);
            fitSeries.setLineStyle(SeriesLines.SOLID);
            fitSeries.setLineColor(new Color(255, 109, 132));
        }

        chartPanel.revalidate();
        chartPanel.repaint();
    }

    private static DocumentListener onChange(Runnable action) {
        return new DocumentListener() {
            @Override public void insertUpdate(DocumentEvent e) { action.run(); }
            @Override public void removeUpdate(DocumentEvent e) { action.run(); }
            @Override public void changedUpdate(DocumentEvent e) { action.run(); }
        };
    }

    /** An input box whose output line is recomputed on every keystroke and every refit. */
    private static final class ConversionBox {
        final JPanel panel = new JPanel(new BorderLayout(0, 4));
        final JTextField input = new JTextField(12);
        final JLabel output = new JLabel(" ");
        final Function<String, String> convert;

        ConversionBox(String title, Function<String, String> convert) {
            this.convert = convert;
            panel.setBorder(BorderFactory.createTitledBorder(title));
            panel.add(input, BorderLayout.NORTH);
            panel.add(output, BorderLayout.CENTER);
            input.getDocument().addDocumentListener(onChange(this::update));
        }

        void update() {
            String text = convert.apply(input.getText());
            output.setText(text.isEmpty() ? " " : text);
        }
    }
}
